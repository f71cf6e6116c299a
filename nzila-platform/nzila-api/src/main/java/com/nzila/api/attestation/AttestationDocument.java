package com.nzila.api.attestation;

import com.nzila.api.execution.ArtifactRef;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.hash.ContentHashing;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Self-describing record of a successful execution.
 *
 * {@code selfHash} is the SHA-256 of the canonical serialization with {@code selfHash}
 * set to the empty string.
 */
public record AttestationDocument(
        String schemaVersion,
        UUID actionId,
        UUID runId,
        int attemptNumber,
        UUID entityId,
        String actionType,
        String periodLabel,
        String requestedBy,
        String approvedBy,
        String proposalHash,
        String policyDecisionHash,
        String policyVersion,
        List<Map<String, Object>> toolCalls,
        String toolCallsHash,
        List<ArtifactRef> artifacts,
        boolean evidencePackEligible,
        Instant executedAt,
        String storagePath,
        String selfHash
) {

    public static final String SCHEMA_VERSION = "1.0";
    static final String SELF_HASH_FIELD = "selfHash";

    public AttestationDocument withSelfHash(String hash) {
        return new AttestationDocument(schemaVersion, actionId, runId, attemptNumber, entityId, actionType,
                periodLabel, requestedBy, approvedBy, proposalHash, policyDecisionHash, policyVersion, toolCalls,
                toolCallsHash, artifacts, evidencePackEligible, executedAt, storagePath, hash);
    }

    /**
     * Computes the self hash and returns the sealed document's canonical bytes.
     */
    public Sealed seal() {
        String hash = selfHashOf(CanonicalJson.readMap(CanonicalJson.write(withSelfHash(""))));
        AttestationDocument sealed = withSelfHash(hash);
        return new Sealed(sealed, CanonicalJson.writeBytes(CanonicalJson.readMap(CanonicalJson.write(sealed))));
    }

    /**
     * Self hash of a parsed document, ignoring whatever self hash it currently carries.
     */
    public static String selfHashOf(Map<String, Object> document) {
        Map<String, Object> unsealed = new TreeMap<>(document);
        unsealed.put(SELF_HASH_FIELD, "");
        return ContentHashing.sha256(CanonicalJson.write(unsealed));
    }

    public record Sealed(AttestationDocument document, byte[] bytes) {}
}
