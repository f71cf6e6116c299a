package com.nzila.api.action;

import com.nzila.api.attestation.AttestationService;
import com.nzila.api.attestation.AttestationVerification;
import com.nzila.api.audit.AuditChainHasher.ChainVerification;
import com.nzila.api.audit.AuditService;
import com.nzila.api.evidence.EvidenceAppendix;
import com.nzila.api.evidence.MerkleTree;
import com.nzila.api.execution.ExecutionRecorder;
import com.nzila.api.execution.StaleRunRecoveryService;
import com.nzila.api.policy.UsageBudgetService;
import com.nzila.api.proposal.ProposalValidationException;
import com.nzila.api.support.EngineFixtures;
import com.nzila.api.support.Proposals;
import com.nzila.api.support.TestActionTypes;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.ActionRun.RunStatus;
import com.nzila.core.domain.AuditEvent;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.repository.ActionRepository;
import com.nzila.core.repository.ActionRunRepository;
import com.nzila.core.repository.AuditEventRepository;
import com.nzila.core.repository.UsageBudgetRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.nzila.api.config.ActionTypesConfig.FINANCE_GENERATE_REPORT;
import static com.nzila.api.config.ActionTypesConfig.KNOWLEDGE_INGEST;
import static org.assertj.core.api.Assertions.*;

/**
 * Full lifecycle against the real Spring context and an in-memory database.
 * Every test works on its own entity id, so tests share the context without cleanup.
 */
@SpringBootTest
@ActiveProfiles("test")
@Import(TestActionTypes.class)
class ActionEngineIntegrationTest {

    private static final ApproverIdentity FINANCE_MANAGER = new ApproverIdentity("maria", Set.of("finance_manager"));
    private static final ApproverIdentity FINANCE_ADMIN = new ApproverIdentity("omar", Set.of("finance_admin"));

    @Autowired private ActionEngine engine;
    @Autowired private ApprovalService approvalService;
    @Autowired private ExecutionRecorder recorder;
    @Autowired private StaleRunRecoveryService staleRunRecovery;
    @Autowired private AuditService auditService;
    @Autowired private AttestationService attestationService;
    @Autowired private UsageBudgetService budgetService;
    @Autowired private ActionRepository actionRepository;
    @Autowired private ActionRunRepository runRepository;
    @Autowired private AuditEventRepository auditRepository;
    @Autowired private UsageBudgetRepository budgetRepository;
    @Autowired private EngineFixtures fixtures;
    @Autowired private JdbcTemplate jdbcTemplate;

    @Test
    void lowRiskReportRunsEndToEndAndShowsInEvidence() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        budgetService.allocate(entityId, "reports", fixtures.currentMonth(), new BigDecimal("10.00"));

        ActionRun run = engine.proposeAndExecute(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-01"));

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(run.getAttemptNumber()).isEqualTo(1);
        assertThat(run.getAttestationPath())
                .startsWith(entityId + "/")
                .endsWith("/" + FINANCE_GENERATE_REPORT + "/" + run.getId() + "/attestation.json");

        Action action = engine.getAction(run.getActionId());
        assertThat(action.getStatus()).isEqualTo(ActionStatus.EXECUTED);

        assertThat(auditService.listEvents(action.getId()))
                .extracting(AuditEvent::getEventType)
                .containsExactly(
                        EventType.ACTION_PROPOSED,
                        EventType.ACTION_POLICY_CHECKED,
                        EventType.ACTION_APPROVED,
                        EventType.RUN_STARTED,
                        EventType.ACTION_EXECUTING,
                        EventType.EXECUTION_SUCCEEDED,
                        EventType.ATTESTATION_STORED);
        ChainVerification chain = auditService.verifyChain(action.getId());
        assertThat(chain.valid()).isTrue();
        assertThat(chain.eventCount()).isEqualTo(7);

        AttestationVerification attestation = attestationService.verify(run.getId());
        assertThat(attestation.valid()).isTrue();
        assertThat(attestation.recomputedSelfHash()).isEqualTo(run.getAttestationSelfHash());

        assertThat(budgetRepository.findByEntityIdAndCategoryAndMonth(entityId, "reports", fixtures.currentMonth()))
                .hasValueSatisfying(budget -> assertThat(budget.getSpentAmount()).isEqualByComparingTo("0.05"));

        EvidenceAppendix evidence = engine.collectEvidence(entityId, "2026-01");
        assertThat(evidence.summary().totalActions()).isEqualTo(1);
        assertThat(evidence.summary().attestationCount()).isEqualTo(1);
        assertThat(evidence.summary().executedActions()).isEqualTo(1);
        assertThat(evidence.summary().failures()).isZero();
        assertThat(evidence.attestationMerkleRoot()).isEqualTo(run.getAttestationSelfHash());
        EvidenceAppendix.RunEvidence runEvidence = evidence.actions().get(0).runs().get(0);
        assertThat(MerkleTree.verifyProof(runEvidence.attestationProof(), evidence.attestationMerkleRoot())).isTrue();
        assertThat(evidence.actions().get(0).ledgerVerified()).isTrue();
    }

    @Test
    void secondReportForSamePeriodReusesTheStoredDocument() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        budgetService.allocate(entityId, "reports", fixtures.currentMonth(), new BigDecimal("10.00"));

        ActionRun first = engine.proposeAndExecute(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-02"));
        ActionRun second = engine.proposeAndExecute(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-02"));

        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(CanonicalJson.readList(second.getArtifactsJson()))
                .isEqualTo(CanonicalJson.readList(first.getArtifactsJson()));
        assertThat(budgetRepository.findByEntityIdAndCategoryAndMonth(entityId, "reports", fixtures.currentMonth()))
                .hasValueSatisfying(budget -> assertThat(budget.getSpentAmount()).isEqualByComparingTo("0.05"));

        EvidenceAppendix evidence = engine.collectEvidence(entityId, "2026-02");
        assertThat(evidence.summary().attestationCount()).isEqualTo(2);
        assertThat(evidence.attestationMerkleRoot()).isNotNull();
    }

    @Test
    void regulatedIngestionIsDeniedAndCannotRun() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(KNOWLEDGE_INGEST));

        Action action = engine.proposeAction(KNOWLEDGE_INGEST,
                Proposals.ingestion(entityId, "regulated", "Confidential board minutes"));

        assertThat(action.getStatus()).isEqualTo(ActionStatus.POLICY_CHECKED);
        assertThat(action.getPolicyOutcome()).isEqualTo("DENY");
        Map<String, Object> decision = CanonicalJson.readMap(action.getPolicyDecisionJson());
        assertThat(decision).containsEntry("failedCheck", "DATA_CLASS_PERMITTED")
                .containsEntry("reasonCode", "DATA_CLASS_NOT_PERMITTED");

        assertThatThrownBy(() -> engine.executeAction(action.getId(), "assistant-7"))
                .isInstanceOf(ActionStateConflictException.class);
        assertThat(runRepository.countByActionId(action.getId())).isZero();
        assertThat(auditService.verifyChain(action.getId()).valid()).isTrue();
    }

    @Test
    void invalidProposalLeavesNoActionAndNoAuditTrail() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        long actionsBefore = actionRepository.count();
        long eventsBefore = auditRepository.count();

        Map<String, Object> payload = new HashMap<>(Proposals.report(entityId, "2026-13"));
        payload.put("surprise", true);

        assertThatThrownBy(() -> engine.proposeAction(FINANCE_GENERATE_REPORT, payload))
                .isInstanceOf(ProposalValidationException.class);
        assertThat(actionRepository.count()).isEqualTo(actionsBefore);
        assertThat(auditRepository.count()).isEqualTo(eventsBefore);
    }

    @Test
    void concurrentApprovalsProduceExactlyOneApprovedEvent() throws Exception {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of());
        Map<String, Object> payload = Proposals.report(entityId, "2026-03");
        payload.put("dataClass", "sensitive");
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, payload);
        assertThat(action.getStatus()).isEqualTo(ActionStatus.AWAITING_APPROVAL);

        int racers = 6;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        List<Future<Action>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < racers; i++) {
                ApproverIdentity approver = i % 2 == 0 ? FINANCE_MANAGER : FINANCE_ADMIN;
                Callable<Action> decide = () -> {
                    start.await();
                    return approvalService.decide(action.getId(), approver, ApprovalDecision.APPROVE, "looks fine");
                };
                futures.add(pool.submit(decide));
            }
            start.countDown();

            int approved = 0;
            int conflicts = 0;
            for (Future<Action> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    approved++;
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ActionStateConflictException.class);
                    conflicts++;
                }
            }
            assertThat(approved).isEqualTo(1);
            assertThat(conflicts).isEqualTo(racers - 1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(auditRepository.countByTargetIdAndEventType(action.getId(), EventType.ACTION_APPROVED)).isEqualTo(1);
        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.APPROVED);
        assertThat(auditService.verifyChain(action.getId()).valid()).isTrue();
    }

    @Test
    void concurrentExecutionsOpenExactlyOneRun() throws Exception {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(TestActionTypes.SLOW));
        Action action = engine.proposeAction(TestActionTypes.SLOW, Proposals.envelope(entityId));
        assertThat(action.getStatus()).isEqualTo(ActionStatus.APPROVED);

        int racers = 4;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(racers);
        List<Future<ActionRun>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < racers; i++) {
                String requester = "worker-" + i;
                Callable<ActionRun> execute = () -> {
                    start.await();
                    return engine.executeAction(action.getId(), requester);
                };
                futures.add(pool.submit(execute));
            }
            start.countDown();

            List<ActionRun> runs = new ArrayList<>();
            int conflicts = 0;
            for (Future<ActionRun> future : futures) {
                try {
                    runs.add(future.get(30, TimeUnit.SECONDS));
                } catch (java.util.concurrent.ExecutionException e) {
                    assertThat(e.getCause()).isInstanceOf(ActionStateConflictException.class);
                    conflicts++;
                }
            }
            assertThat(runs).singleElement()
                    .satisfies(run -> assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED));
            assertThat(conflicts).isEqualTo(racers - 1);
        } finally {
            pool.shutdownNow();
        }

        assertThat(runRepository.countByActionId(action.getId())).isEqualTo(1);
        assertThat(auditRepository.countByTargetIdAndEventType(action.getId(), EventType.RUN_STARTED)).isEqualTo(1);
        assertThat(auditService.verifyChain(action.getId()).valid()).isTrue();
    }

    @Test
    void actionAwaitingApprovalCannotBeExecuted() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of());
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-07"));
        assertThat(action.getStatus()).isEqualTo(ActionStatus.AWAITING_APPROVAL);
        long events = auditRepository.countByTargetId(action.getId());

        assertThatThrownBy(() -> engine.executeAction(action.getId(), "assistant-7"))
                .isInstanceOf(ActionStateConflictException.class);

        assertThat(runRepository.countByActionId(action.getId())).isZero();
        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.AWAITING_APPROVAL);
        assertThat(auditRepository.countByTargetId(action.getId())).isEqualTo(events);
    }

    @Test
    void unauthorizedApproverIsRefusedAndAudited() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of());
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-04"));
        ApproverIdentity intern = new ApproverIdentity("kim", Set.of("viewer"));

        assertThatThrownBy(() -> approvalService.decide(action.getId(), intern, ApprovalDecision.APPROVE, null))
                .isInstanceOf(ApproverNotAuthorizedException.class);

        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.AWAITING_APPROVAL);
        assertThat(auditRepository.findByTargetIdAndEventTypeOrderBySequenceAsc(action.getId(), EventType.APPROVAL_REFUSED))
                .singleElement()
                .satisfies(event -> assertThat(event.getActor()).isEqualTo("kim"));
    }

    @Test
    void rejectedActionCannotBeExecuted() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of());
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-05"));

        Action rejected = approvalService.decide(action.getId(), FINANCE_ADMIN, ApprovalDecision.REJECT, "wrong period");

        assertThat(rejected.getStatus()).isEqualTo(ActionStatus.REJECTED);
        assertThatThrownBy(() -> engine.executeAction(action.getId(), "omar"))
                .isInstanceOf(ActionStateConflictException.class);
        assertThat(runRepository.countByActionId(action.getId())).isZero();
    }

    @Test
    void pendingApprovalExpiresAfterItsWindow() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of());
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-06"));

        approvalService.expireDue(action.getExpiresAt().plusSeconds(1));

        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.EXPIRED);
        assertThat(auditRepository.countByTargetIdAndEventType(action.getId(), EventType.ACTION_EXPIRED)).isEqualTo(1);
        assertThatThrownBy(() -> approvalService.decide(action.getId(), FINANCE_ADMIN, ApprovalDecision.APPROVE, null))
                .isInstanceOf(ActionStateConflictException.class);
    }

    @Test
    void toolTimeoutFailsTheRun() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(TestActionTypes.SLOW));

        ActionRun run = engine.proposeAndExecute(TestActionTypes.SLOW, Proposals.envelope(entityId));

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError()).contains("timed out");
        assertThat(engine.getAction(run.getActionId()).getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(auditRepository.findByTargetIdAndEventTypeOrderBySequenceAsc(run.getActionId(), EventType.EXECUTION_FAILED))
                .singleElement()
                .satisfies(event -> assertThat(CanonicalJson.readMap(event.getPayloadJson()))
                        .containsEntry("reason", "TOOL_TIMEOUT"));
    }

    @Test
    void unreadableProposalFailsTheRunInsteadOfLeavingItOpen() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-09"));
        assertThat(action.getStatus()).isEqualTo(ActionStatus.APPROVED);
        jdbcTemplate.update("UPDATE ai_actions SET proposal_json = ? WHERE id = ?", "{not json", action.getId());

        ActionRun run = engine.executeAction(action.getId(), "assistant-7");

        assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(run.getError()).startsWith("Preparation failed");
        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.FAILED);
        assertThat(runRepository.existsByActionIdAndStatus(action.getId(), RunStatus.STARTED)).isFalse();
        assertThat(auditRepository.findByTargetIdAndEventTypeOrderBySequenceAsc(action.getId(), EventType.EXECUTION_FAILED))
                .singleElement()
                .satisfies(event -> assertThat(CanonicalJson.readMap(event.getPayloadJson()))
                        .containsEntry("reason", "PREPARATION_ERROR"));
    }

    @Test
    void failedActionSucceedsOnRetry() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(TestActionTypes.FLAKY));

        ActionRun failed = engine.proposeAndExecute(TestActionTypes.FLAKY, Proposals.envelope(entityId));
        assertThat(failed.getStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(failed.getError()).isEqualTo("upstream unavailable");

        Action retried = engine.retryAction(failed.getActionId(), "omar");
        assertThat(retried.getStatus()).isEqualTo(ActionStatus.APPROVED);
        ActionRun second = engine.executeAction(failed.getActionId(), "omar");

        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(second.getAttemptNumber()).isEqualTo(2);
        assertThat(runRepository.findByActionIdOrderByAttemptNumberAsc(failed.getActionId()))
                .extracting(ActionRun::getStatus)
                .containsExactly(RunStatus.FAILED, RunStatus.SUCCESS);
        assertThat(auditService.verifyChain(failed.getActionId()).valid()).isTrue();
    }

    @Test
    void retryOfAnExecutedActionConflicts() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        ActionRun run = engine.proposeAndExecute(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-07"));

        assertThatThrownBy(() -> engine.retryAction(run.getActionId(), "omar"))
                .isInstanceOf(ActionStateConflictException.class);
    }

    @Test
    void abandonedRunIsRecoveredAsFailed() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(FINANCE_GENERATE_REPORT));
        Action action = engine.proposeAction(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-08"));
        ActionRun abandoned = recorder.beginRun(action.getId(), "assistant-7").run();

        staleRunRecovery.recoverStaleRuns(Instant.now().plus(Duration.ofMinutes(1)));

        assertThat(runRepository.findById(abandoned.getId()))
                .hasValueSatisfying(run -> assertThat(run.getStatus()).isEqualTo(RunStatus.FAILED));
        assertThat(engine.getAction(action.getId()).getStatus()).isEqualTo(ActionStatus.FAILED);
    }
}
