package com.nzila.api.action;

import com.nzila.api.evidence.EvidenceAppendix;
import com.nzila.api.evidence.EvidenceCollectorService;
import com.nzila.api.execution.ExecutionDispatcher;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.ActionRun;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.UUID;

/**
 * Entry point for the action lifecycle: propose, decide, execute, retry, and collect evidence.
 */
@Service
public class ActionEngine {

    private final ActionLifecycleService lifecycleService;
    private final ApprovalService approvalService;
    private final ExecutionDispatcher dispatcher;
    private final EvidenceCollectorService evidenceCollector;

    public ActionEngine(ActionLifecycleService lifecycleService,
                        ApprovalService approvalService,
                        ExecutionDispatcher dispatcher,
                        EvidenceCollectorService evidenceCollector) {
        this.lifecycleService = lifecycleService;
        this.approvalService = approvalService;
        this.dispatcher = dispatcher;
        this.evidenceCollector = evidenceCollector;
    }

    public Action proposeAction(String actionType, Map<String, Object> payload) {
        return lifecycleService.propose(actionType, payload);
    }

    public Action approveAction(UUID actionId, ApproverIdentity approver, ApprovalDecision decision, String reason) {
        return approvalService.decide(actionId, approver, decision, reason);
    }

    public ActionRun executeAction(UUID actionId, String requestedBy) {
        return dispatcher.execute(actionId, requestedBy);
    }

    public Action retryAction(UUID actionId, String requestedBy) {
        return lifecycleService.retry(actionId, requestedBy);
    }

    /**
     * Proposes and, when policy auto-approves, executes in one call.
     *
     * @throws ActionStateConflictException when the proposal was not auto-approved;
     *                                      the proposed action is kept either way
     */
    public ActionRun proposeAndExecute(String actionType, Map<String, Object> payload) {
        Action action = lifecycleService.propose(actionType, payload);
        if (action.getStatus() != ActionStatus.APPROVED) {
            throw new ActionStateConflictException(action.getId(), action.getStatus(),
                    "Action " + action.getId() + " was not auto-approved (" + action.getStatus() + ", "
                            + action.getPolicyOutcome() + ")");
        }
        return dispatcher.execute(action.getId(), action.getRequestedBy());
    }

    public Action getAction(UUID actionId) {
        return lifecycleService.getAction(actionId);
    }

    public EvidenceAppendix collectEvidence(UUID entityId, String periodLabel) {
        return evidenceCollector.collect(entityId, periodLabel);
    }
}
