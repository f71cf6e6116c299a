package com.nzila.api.evidence;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/evidence")
public class EvidenceController {

    private final EvidenceCollectorService evidenceCollector;

    public EvidenceController(EvidenceCollectorService evidenceCollector) {
        this.evidenceCollector = evidenceCollector;
    }

    /**
     * GET /api/v1/evidence/{entityId}/{period}
     */
    @GetMapping("/{entityId}/{period}")
    public ResponseEntity<EvidenceAppendix> collect(@PathVariable UUID entityId, @PathVariable String period) {
        return ResponseEntity.ok(evidenceCollector.collect(entityId, period));
    }

    @ExceptionHandler(EvidenceCollectorService.InvalidPeriodException.class)
    public ResponseEntity<ErrorResponse> handleInvalidPeriod(EvidenceCollectorService.InvalidPeriodException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_PERIOD", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
