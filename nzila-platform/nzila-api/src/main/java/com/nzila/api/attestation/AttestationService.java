package com.nzila.api.attestation;

import com.nzila.api.execution.ArtifactRef;
import com.nzila.api.storage.DocumentStorageService;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.StoredDocument;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.hash.ContentHashing;
import com.nzila.core.repository.ActionRunRepository;
import com.nzila.core.repository.StoredDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Generates, stores and verifies attestation documents for successful runs.
 */
@Service
public class AttestationService {

    private static final Logger log = LoggerFactory.getLogger(AttestationService.class);

    static final String CONTENT_TYPE = "application/json";

    private final DocumentStorageService documentStorage;
    private final StoredDocumentRepository documentRepository;
    private final ActionRunRepository runRepository;
    private final Clock clock;

    public AttestationService(DocumentStorageService documentStorage,
                              StoredDocumentRepository documentRepository,
                              ActionRunRepository runRepository,
                              Clock clock) {
        this.documentStorage = documentStorage;
        this.documentRepository = documentRepository;
        this.runRepository = runRepository;
        this.clock = clock;
    }

    /**
     * Builds the attestation for a finished run, seals it and stores it with its documents row.
     */
    @Transactional
    public StoredAttestation attest(Action action, ActionRun run, String policyVersion,
                                    List<Map<String, Object>> sanitizedTrace, List<ArtifactRef> artifacts) {
        Instant executedAt = clock.instant();
        String path = storagePath(action.getEntityId(), executedAt, action.getActionType(), run.getId());

        AttestationDocument document = new AttestationDocument(
                AttestationDocument.SCHEMA_VERSION,
                action.getId(),
                run.getId(),
                run.getAttemptNumber(),
                action.getEntityId(),
                action.getActionType(),
                action.getPeriodLabel(),
                run.getRequestedBy(),
                action.getDecidedBy(),
                action.getProposalHash(),
                ContentHashing.sha256(action.getPolicyDecisionJson()),
                policyVersion,
                sanitizedTrace,
                CanonicalJson.hash(sanitizedTrace),
                artifacts,
                action.isEvidencePackEligible(),
                executedAt,
                path,
                "");

        AttestationDocument.Sealed sealed = document.seal();
        StoredDocument stored = documentStorage.store(
                action.getEntityId(), StoredDocument.CATEGORY_ATTESTATION, path, sealed.bytes(),
                CONTENT_TYPE, action.getId(), run.getId());

        log.info("Attestation {} stored for run {} of action {}", stored.getId(), run.getId(), action.getId());
        return new StoredAttestation(stored.getId(), path, sealed.document().selfHash(), stored.getContentHash());
    }

    /**
     * Reloads a run's attestation and checks both its storage hash and its self hash.
     */
    @Transactional(readOnly = true)
    public AttestationVerification verify(UUID runId) {
        ActionRun run = runRepository.findById(runId)
                .orElseThrow(() -> new AttestationNotFoundException("Run not found: " + runId));
        String path = run.getAttestationPath();
        if (path == null) {
            return new AttestationVerification(runId, null, false, false, false, null, null);
        }

        Optional<StoredDocument> document = documentRepository.findByBlobPath(path);
        Optional<byte[]> bytes = documentStorage.read(path);
        if (document.isEmpty() || bytes.isEmpty()) {
            log.warn("Attestation for run {} missing at {}", runId, path);
            return new AttestationVerification(runId, path, false, false, false, run.getAttestationSelfHash(), null);
        }

        boolean storageValid = ContentHashing.matches(document.get().getContentHash(), ContentHashing.sha256(bytes.get()));
        Map<String, Object> parsed = CanonicalJson.readMap(bytes.get());
        Object embedded = parsed.get(AttestationDocument.SELF_HASH_FIELD);
        String storedSelfHash = embedded == null ? null : embedded.toString();
        String recomputed = AttestationDocument.selfHashOf(parsed);
        boolean selfValid = ContentHashing.matches(recomputed, storedSelfHash)
                && ContentHashing.matches(recomputed, run.getAttestationSelfHash());

        if (!storageValid || !selfValid) {
            log.warn("Attestation for run {} failed verification (storage={}, self={})", runId, storageValid, selfValid);
        }
        return new AttestationVerification(runId, path, true, storageValid, selfValid, storedSelfHash, recomputed);
    }

    static String storagePath(UUID entityId, Instant executedAt, String actionType, UUID runId) {
        ZonedDateTime at = executedAt.atZone(ZoneOffset.UTC);
        return String.format("%s/%04d/%02d/%s/%s/attestation.json",
                entityId, at.getYear(), at.getMonthValue(), actionType, runId);
    }

    public record StoredAttestation(UUID documentId, String path, String selfHash, String contentHash) {}

    public static class AttestationNotFoundException extends RuntimeException {
        public AttestationNotFoundException(String message) { super(message); }
    }
}
