package com.nzila.api.evidence;

import com.nzila.api.audit.AuditChainHasher.ChainVerification;
import com.nzila.api.audit.AuditService;
import com.nzila.api.evidence.EvidenceAppendix.ActionEvidence;
import com.nzila.api.evidence.EvidenceAppendix.DocumentEvidence;
import com.nzila.api.evidence.EvidenceAppendix.IngestionEvidence;
import com.nzila.api.evidence.EvidenceAppendix.RunEvidence;
import com.nzila.api.evidence.EvidenceAppendix.Summary;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.ActionRun.RunStatus;
import com.nzila.core.domain.KnowledgeIngestionRun;
import com.nzila.core.domain.StoredDocument;
import com.nzila.core.repository.ActionRepository;
import com.nzila.core.repository.ActionRunRepository;
import com.nzila.core.repository.KnowledgeIngestionRunRepository;
import com.nzila.core.repository.StoredDocumentRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Assembles the evidence appendix for an entity and period. Read-only.
 */
@Service
public class EvidenceCollectorService {

    private static final Pattern PERIOD = Pattern.compile("\\d{4}-(0[1-9]|1[0-2])");

    private final ActionRepository actionRepository;
    private final ActionRunRepository runRepository;
    private final StoredDocumentRepository documentRepository;
    private final KnowledgeIngestionRunRepository ingestionRepository;
    private final AuditService auditService;
    private final Clock clock;

    public EvidenceCollectorService(ActionRepository actionRepository,
                                    ActionRunRepository runRepository,
                                    StoredDocumentRepository documentRepository,
                                    KnowledgeIngestionRunRepository ingestionRepository,
                                    AuditService auditService,
                                    Clock clock) {
        this.actionRepository = actionRepository;
        this.runRepository = runRepository;
        this.documentRepository = documentRepository;
        this.ingestionRepository = ingestionRepository;
        this.auditService = auditService;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public EvidenceAppendix collect(UUID entityId, String periodLabel) {
        if (periodLabel == null || !PERIOD.matcher(periodLabel).matches()) {
            throw new InvalidPeriodException("Period must be YYYY-MM: " + periodLabel);
        }

        List<Action> actions = actionRepository.findEvidenceEligible(entityId, periodLabel);
        List<UUID> actionIds = actions.stream().map(Action::getId).toList();
        if (actionIds.isEmpty()) {
            return new EvidenceAppendix(entityId, periodLabel, new Summary(0, 0, 0, 0), List.of(), null, clock.instant());
        }

        List<ActionRun> runs = runRepository.findByActionIds(actionIds);
        Map<UUID, List<StoredDocument>> documentsByAction = documentRepository.findByActionIdIn(actionIds).stream()
                .sorted(Comparator.comparing(StoredDocument::getCreatedAt).thenComparing(StoredDocument::getBlobPath))
                .collect(Collectors.groupingBy(StoredDocument::getActionId));
        Map<UUID, List<KnowledgeIngestionRun>> ingestionsByAction = ingestionRepository.findByActionIdIn(actionIds).stream()
                .sorted(Comparator.comparing(KnowledgeIngestionRun::getCreatedAt))
                .collect(Collectors.groupingBy(KnowledgeIngestionRun::getActionId));

        // Runs arrive ordered by start; attested ones become Merkle leaves in that order
        List<ActionRun> attested = runs.stream().filter(run -> run.getAttestationSelfHash() != null).toList();
        MerkleTree tree = attested.isEmpty() ? null
                : MerkleTree.build(attested.stream().map(ActionRun::getAttestationSelfHash).toList());
        Map<UUID, Integer> leafIndex = new HashMap<>();
        for (int i = 0; i < attested.size(); i++) {
            leafIndex.put(attested.get(i).getId(), i);
        }

        Map<UUID, List<ActionRun>> runsByAction = runs.stream().collect(Collectors.groupingBy(ActionRun::getActionId));

        List<ActionEvidence> evidence = new ArrayList<>();
        int failures = 0;
        int executed = 0;
        for (Action action : actions) {
            List<RunEvidence> runEvidence = new ArrayList<>();
            for (ActionRun run : runsByAction.getOrDefault(action.getId(), List.of())) {
                if (run.getStatus() == RunStatus.FAILED) {
                    failures++;
                }
                Integer index = leafIndex.get(run.getId());
                runEvidence.add(new RunEvidence(
                        run.getId(),
                        run.getAttemptNumber(),
                        run.getStatus(),
                        run.getStartedAt(),
                        run.getFinishedAt(),
                        run.getAttestationDocumentId(),
                        run.getAttestationPath(),
                        run.getAttestationSelfHash(),
                        index == null ? null : tree.getProof(index),
                        run.getError()));
            }
            if (action.getStatus() == ActionStatus.EXECUTED) {
                executed++;
            }

            List<DocumentEvidence> documents = documentsByAction.getOrDefault(action.getId(), List.of()).stream()
                    .map(doc -> new DocumentEvidence(doc.getId(), doc.getCategory(), doc.getBlobPath(),
                            doc.getContentHash(), doc.getRunId()))
                    .toList();
            List<IngestionEvidence> ingestions = ingestionsByAction.getOrDefault(action.getId(), List.of()).stream()
                    .map(run -> new IngestionEvidence(run.getId(), run.getSourceId(), run.getStatus(),
                            run.getChunkCount(), run.getEmbeddingCount(), run.getManifestDocumentId()))
                    .toList();

            ChainVerification ledger = auditService.verifyChain(action.getId());
            evidence.add(new ActionEvidence(
                    action.getId(),
                    action.getActionType(),
                    action.getStatus(),
                    action.getRiskTier(),
                    action.getPolicyOutcome(),
                    action.getProposalHash(),
                    action.getRequestedBy(),
                    action.getDecidedBy(),
                    action.getProposedAt(),
                    action.getExecutedAt(),
                    ledger.valid(),
                    ledger.eventCount(),
                    List.copyOf(runEvidence),
                    documents,
                    ingestions));
        }

        Summary summary = new Summary(actions.size(), attested.size(), failures, executed);
        return new EvidenceAppendix(entityId, periodLabel, summary, List.copyOf(evidence),
                tree == null ? null : tree.getRoot(), clock.instant());
    }

    public static class InvalidPeriodException extends RuntimeException {
        public InvalidPeriodException(String message) { super(message); }
    }
}
