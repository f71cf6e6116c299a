package com.nzila.api.attestation;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/attestations")
public class AttestationController {

    private final AttestationService attestationService;

    public AttestationController(AttestationService attestationService) {
        this.attestationService = attestationService;
    }

    /**
     * GET /api/v1/attestations/{runId}/verify
     */
    @GetMapping("/{runId}/verify")
    public ResponseEntity<AttestationVerification> verify(@PathVariable UUID runId) {
        return ResponseEntity.ok(attestationService.verify(runId));
    }

    @ExceptionHandler(AttestationService.AttestationNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(AttestationService.AttestationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ErrorResponse("ATTESTATION_NOT_FOUND", e.getMessage()));
    }

    public record ErrorResponse(String code, String message) {}
}
