package com.nzila.api.audit;

import com.nzila.api.audit.AuditChainHasher.ChainVerification;
import com.nzila.core.domain.AuditEvent;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * Read-only access to the ledger.
 */
@RestController
@RequestMapping("/api/v1/audit")
public class AuditController {

    private final AuditService auditService;

    public AuditController(AuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * GET /api/v1/audit/{targetId}
     */
    @GetMapping("/{targetId}")
    public ResponseEntity<List<AuditEvent>> getEvents(@PathVariable UUID targetId) {
        return ResponseEntity.ok(auditService.listEvents(targetId));
    }

    /**
     * GET /api/v1/audit/{targetId}/verify
     */
    @GetMapping("/{targetId}/verify")
    public ResponseEntity<ChainVerification> verifyChain(@PathVariable UUID targetId) {
        return ResponseEntity.ok(auditService.verifyChain(targetId));
    }
}
