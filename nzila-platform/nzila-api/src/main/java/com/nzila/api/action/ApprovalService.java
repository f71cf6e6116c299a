package com.nzila.api.action;

import com.nzila.api.audit.AuditService;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.AuditEvent.ActorType;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.repository.ActionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Human decisions on AWAITING_APPROVAL actions, and expiry of undecided ones.
 *
 * Every decision runs in its own transaction holding the action's row lock, so of two
 * concurrent decisions (or a decision racing the expiry sweep) the first to commit wins and
 * the other sees a state conflict. Failures surfacing at commit time are translated too.
 */
@Service
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    static final String EXPIRY_ACTOR = "nzila-expiry";

    private final ActionRepository actionRepository;
    private final AuditService auditService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ApprovalService(ActionRepository actionRepository,
                           AuditService auditService,
                           PlatformTransactionManager transactionManager,
                           Clock clock) {
        this.actionRepository = actionRepository;
        this.auditService = auditService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * Applies an approve or reject decision.
     *
     * @throws ActionStateConflictException    when the action is not awaiting approval or its window elapsed
     * @throws ApproverNotAuthorizedException  when the approver holds none of the required roles;
     *                                         the refusal itself is recorded in the ledger
     */
    public Action decide(UUID actionId, ApproverIdentity approver, ApprovalDecision decision, String reason) {
        DecisionOutcome outcome = ConflictTranslator.translate(actionId,
                () -> transactionTemplate.execute(status -> applyDecision(actionId, approver, decision, reason)));
        if (outcome.refusedRoles() != null) {
            throw new ApproverNotAuthorizedException(actionId, approver.id(), outcome.refusedRoles());
        }
        return outcome.action();
    }

    /**
     * Expires every awaiting action whose window has elapsed, one transaction each.
     */
    public int expireDue() {
        return expireDue(clock.instant());
    }

    public int expireDue(Instant asOf) {
        List<UUID> due = actionRepository.findIdsByStatusExpiringBefore(ActionStatus.AWAITING_APPROVAL, asOf);
        int expired = 0;
        for (UUID actionId : due) {
            try {
                Boolean done = ConflictTranslator.translate(actionId,
                        () -> transactionTemplate.execute(status -> expireIfDue(actionId, asOf)));
                if (Boolean.TRUE.equals(done)) {
                    expired++;
                }
            } catch (ActionStateConflictException e) {
                log.debug("Expiry of action {} lost to a concurrent decision", actionId);
            }
        }
        if (expired > 0) {
            log.info("Expired {} actions awaiting approval", expired);
        }
        return expired;
    }

    private DecisionOutcome applyDecision(UUID actionId, ApproverIdentity approver,
                                          ApprovalDecision decision, String reason) {
        Action action = actionRepository.findForUpdate(actionId)
                .orElseThrow(() -> new ActionNotFoundException(actionId));
        Instant now = clock.instant();

        if (action.getStatus() != ActionStatus.AWAITING_APPROVAL) {
            throw new ActionStateConflictException(actionId, action.getStatus(),
                    "Action " + actionId + " is " + action.getStatus() + ", not awaiting approval");
        }
        if (action.isApprovalExpired(now)) {
            throw new ActionStateConflictException(actionId, action.getStatus(),
                    "Approval window for action " + actionId + " elapsed at " + action.getExpiresAt());
        }

        List<String> requiredRoles = requiredRoles(action);
        if (!approver.holdsAnyOf(requiredRoles)) {
            Map<String, Object> refused = new LinkedHashMap<>();
            refused.put("decision", decision.name());
            refused.put("requiredApproverRoles", requiredRoles);
            refused.put("approverRoles", approver.roles().stream().sorted().toList());
            auditService.appendForAction(actionId, EventType.APPROVAL_REFUSED, approver.id(), ActorType.HUMAN, refused);
            log.warn("Approver {} refused for action {}: lacks {}", approver.id(), actionId, requiredRoles);
            return new DecisionOutcome(action, requiredRoles);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("decision", decision.name());
        payload.put("reason", reason == null ? "" : reason);
        payload.put("approverRoles", approver.roles().stream().sorted().toList());
        if (decision == ApprovalDecision.APPROVE) {
            action.approve(approver.id(), reason, now);
            auditService.appendForAction(actionId, EventType.ACTION_APPROVED, approver.id(), ActorType.HUMAN, payload);
        } else {
            action.reject(approver.id(), reason, now);
            auditService.appendForAction(actionId, EventType.ACTION_REJECTED, approver.id(), ActorType.HUMAN, payload);
        }
        log.info("Action {} {} by {}", actionId, action.getStatus(), approver.id());
        return new DecisionOutcome(action, null);
    }

    private Boolean expireIfDue(UUID actionId, Instant asOf) {
        Action action = actionRepository.findForUpdate(actionId).orElse(null);
        if (action == null || !action.isApprovalExpired(asOf)) {
            return false;
        }
        action.expire(asOf);
        auditService.appendForAction(actionId, EventType.ACTION_EXPIRED, EXPIRY_ACTOR, ActorType.SYSTEM,
                Map.of("expiresAt", action.getExpiresAt().toString()));
        return true;
    }

    private static List<String> requiredRoles(Action action) {
        List<String> roles = new ArrayList<>();
        CanonicalJson.readList(action.getRequiredApproverRoles()).forEach(role -> roles.add(String.valueOf(role)));
        return roles;
    }

    private record DecisionOutcome(Action action, List<String> refusedRoles) {}
}
