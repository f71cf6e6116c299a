package com.nzila.api.execution;

import com.nzila.api.action.ActionNotFoundException;
import com.nzila.api.action.ActionStateConflictException;
import com.nzila.api.attestation.AttestationService;
import com.nzila.api.attestation.AttestationService.StoredAttestation;
import com.nzila.api.audit.AuditService;
import com.nzila.api.policy.BudgetService;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.ActionRun.RunStatus;
import com.nzila.core.domain.AuditEvent.ActorType;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.repository.ActionRepository;
import com.nzila.core.repository.ActionRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Transactional steps around a tool invocation. Each method locks the action row,
 * changes run and action state, and appends the matching ledger events in one transaction.
 * The tool itself runs outside any transaction.
 */
@Component
public class ExecutionRecorder {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRecorder.class);

    static final String ENGINE_ACTOR = "nzila-engine";

    private final ActionRepository actionRepository;
    private final ActionRunRepository runRepository;
    private final AuditService auditService;
    private final AttestationService attestationService;
    private final BudgetService budgetService;
    private final Clock clock;

    public ExecutionRecorder(ActionRepository actionRepository,
                             ActionRunRepository runRepository,
                             AuditService auditService,
                             AttestationService attestationService,
                             BudgetService budgetService,
                             Clock clock) {
        this.actionRepository = actionRepository;
        this.runRepository = runRepository;
        this.auditService = auditService;
        this.attestationService = attestationService;
        this.budgetService = budgetService;
        this.clock = clock;
    }

    /**
     * Creates a STARTED run and moves the action to EXECUTING.
     */
    @Transactional
    public RunStart beginRun(UUID actionId, String requestedBy) {
        Action action = actionRepository.findForUpdate(actionId)
                .orElseThrow(() -> new ActionNotFoundException(actionId));
        if (action.getStatus() != ActionStatus.APPROVED) {
            throw new ActionStateConflictException(actionId, action.getStatus(),
                    "Action " + actionId + " is " + action.getStatus() + ", only APPROVED actions can be executed");
        }
        if (runRepository.existsByActionIdAndStatus(actionId, RunStatus.STARTED)) {
            throw new ActionStateConflictException(actionId, action.getStatus(),
                    "Action " + actionId + " already has a run in progress");
        }

        Instant now = clock.instant();
        int attempt = (int) runRepository.countByActionId(actionId) + 1;
        ActionRun run = runRepository.save(ActionRun.start(actionId, action.getEntityId(), requestedBy, attempt, now));

        auditService.appendForAction(actionId, EventType.RUN_STARTED, requestedBy, ActorType.HUMAN,
                Map.of("runId", run.getId().toString(), "attemptNumber", attempt));
        action.startExecution(now);
        auditService.appendForAction(actionId, EventType.ACTION_EXECUTING, ENGINE_ACTOR, ActorType.SYSTEM,
                Map.of("runId", run.getId().toString(), "status", action.getStatus().name()));

        log.info("Action {} executing as run {} (attempt {})", actionId, run.getId(), attempt);
        return new RunStart(run, action);
    }

    /**
     * Seals the attestation, finalizes the run as SUCCESS, marks the action EXECUTED
     * and charges the reported cost to the usage budget.
     */
    @Transactional
    public ActionRun completeRun(UUID runId, ToolResult result, List<Map<String, Object>> sanitizedTrace,
                                 String budgetCategory) {
        ActionRun run = requireRun(runId);
        Action action = actionRepository.findForUpdate(run.getActionId())
                .orElseThrow(() -> new ActionNotFoundException(run.getActionId()));
        requireStarted(run, action);

        String policyVersion = String.valueOf(CanonicalJson.readMap(action.getPolicyDecisionJson()).get("policyVersion"));
        StoredAttestation attestation = attestationService.attest(
                action, run, policyVersion, sanitizedTrace, result.artifacts());

        Instant now = clock.instant();
        run.succeed(CanonicalJson.write(sanitizedTrace), CanonicalJson.write(result.artifacts()),
                attestation.documentId(), attestation.path(), attestation.selfHash(), now);
        action.markExecuted(now);

        Map<String, Object> succeeded = new LinkedHashMap<>();
        succeeded.put("runId", runId.toString());
        succeeded.put("artifactCount", result.artifacts().size());
        succeeded.put("traceHash", CanonicalJson.hash(sanitizedTrace));
        succeeded.put("cost", result.cost().toPlainString());
        auditService.appendForAction(action.getId(), EventType.EXECUTION_SUCCEEDED, ENGINE_ACTOR, ActorType.SYSTEM, succeeded);
        auditService.appendForAction(action.getId(), EventType.ATTESTATION_STORED, ENGINE_ACTOR, ActorType.SYSTEM,
                Map.of("runId", runId.toString(),
                        "documentId", attestation.documentId().toString(),
                        "path", attestation.path(),
                        "selfHash", attestation.selfHash()));

        if (budgetCategory != null) {
            String month = YearMonth.from(now.atZone(ZoneOffset.UTC)).toString();
            budgetService.recordSpend(action.getEntityId(), budgetCategory, month, result.cost());
        }

        log.info("Action {} executed by run {}", action.getId(), runId);
        return run;
    }

    /**
     * Finalizes the run as FAILED with the error kept verbatim and marks the action FAILED.
     */
    @Transactional
    public ActionRun failRun(UUID runId, String error, List<Map<String, Object>> sanitizedTrace, String reason) {
        ActionRun run = requireRun(runId);
        Action action = actionRepository.findForUpdate(run.getActionId())
                .orElseThrow(() -> new ActionNotFoundException(run.getActionId()));
        requireStarted(run, action);

        Instant now = clock.instant();
        run.fail(error, CanonicalJson.write(sanitizedTrace == null ? List.of() : sanitizedTrace), now);
        action.markFailed(now);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("runId", runId.toString());
        payload.put("reason", reason);
        payload.put("error", error);
        auditService.appendForAction(action.getId(), EventType.EXECUTION_FAILED, ENGINE_ACTOR, ActorType.SYSTEM, payload);

        log.warn("Action {} failed in run {} ({})", action.getId(), runId, reason);
        return run;
    }

    private ActionRun requireRun(UUID runId) {
        return runRepository.findById(runId)
                .orElseThrow(() -> new IllegalStateException("Run not found: " + runId));
    }

    private void requireStarted(ActionRun run, Action action) {
        if (run.getStatus() != RunStatus.STARTED || action.getStatus() != ActionStatus.EXECUTING) {
            throw new ActionStateConflictException(action.getId(), action.getStatus(),
                    "Run " + run.getId() + " was already finalized as " + run.getStatus());
        }
    }

    public record RunStart(ActionRun run, Action action) {}
}
