package com.nzila.api.evidence;

import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.Action.RiskTier;
import com.nzila.core.domain.ActionRun.RunStatus;
import com.nzila.core.domain.KnowledgeIngestionRun.IngestionStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Compliance appendix for one entity and period.
 *
 * @param attestationMerkleRoot root over attestation self hashes in run start order,
 *                              {@code null} when the period has no attestations
 */
public record EvidenceAppendix(
        UUID entityId,
        String periodLabel,
        Summary summary,
        List<ActionEvidence> actions,
        String attestationMerkleRoot,
        Instant generatedAt
) {

    /**
     * @param failures number of failed runs
     */
    public record Summary(int totalActions, int attestationCount, int failures, int executedActions) {}

    public record ActionEvidence(
            UUID actionId,
            String actionType,
            ActionStatus status,
            RiskTier riskTier,
            String policyOutcome,
            String proposalHash,
            String requestedBy,
            String decidedBy,
            Instant proposedAt,
            Instant executedAt,
            boolean ledgerVerified,
            int ledgerEventCount,
            List<RunEvidence> runs,
            List<DocumentEvidence> documents,
            List<IngestionEvidence> ingestions
    ) {}

    public record RunEvidence(
            UUID runId,
            int attemptNumber,
            RunStatus status,
            Instant startedAt,
            Instant finishedAt,
            UUID attestationDocumentId,
            String attestationPath,
            String attestationSelfHash,
            MerkleTree.MerkleProof attestationProof,
            String error
    ) {}

    public record DocumentEvidence(UUID documentId, String category, String path, String contentHash, UUID runId) {}

    public record IngestionEvidence(
            UUID ingestionRunId,
            UUID sourceId,
            IngestionStatus status,
            int chunkCount,
            int embeddingCount,
            UUID manifestDocumentId
    ) {}
}
