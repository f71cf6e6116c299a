package com.nzila.api.action;

import com.nzila.api.audit.AuditService;
import com.nzila.api.policy.ActionPolicyEngine;
import com.nzila.api.policy.BudgetService;
import com.nzila.api.policy.BudgetSnapshot;
import com.nzila.api.policy.CapabilityProfileSnapshot;
import com.nzila.api.policy.CapabilityProfileStore;
import com.nzila.api.policy.PolicyDecision;
import com.nzila.api.policy.PolicyInput;
import com.nzila.api.proposal.ProposalValidator;
import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.api.registry.ActionTypeDefinition;
import com.nzila.api.registry.ActionTypeRegistry;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import com.nzila.core.domain.AuditEvent.ActorType;
import com.nzila.core.domain.AuditEvent.EventType;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.repository.ActionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Proposal intake and the policy gate.
 *
 * A proposal is validated before anything is written. A valid one becomes an Action in
 * PROPOSED, is evaluated by the policy engine and moves to POLICY_CHECKED, then on to
 * APPROVED or AWAITING_APPROVAL unless denied. Each transition appends one ledger event
 * in the same transaction.
 */
@Service
public class ActionLifecycleService {

    private static final Logger log = LoggerFactory.getLogger(ActionLifecycleService.class);

    static final String POLICY_ACTOR = "nzila-policy";

    private final ProposalValidator validator;
    private final ActionTypeRegistry registry;
    private final ActionPolicyEngine policyEngine;
    private final CapabilityProfileStore profileStore;
    private final BudgetService budgetService;
    private final ActionRepository actionRepository;
    private final AuditService auditService;
    private final Clock clock;
    private final Duration approvalTtl;
    private final boolean budgetRequired;

    public ActionLifecycleService(ProposalValidator validator,
                                  ActionTypeRegistry registry,
                                  ActionPolicyEngine policyEngine,
                                  CapabilityProfileStore profileStore,
                                  BudgetService budgetService,
                                  ActionRepository actionRepository,
                                  AuditService auditService,
                                  Clock clock,
                                  @Value("${nzila.approval.ttl:PT72H}") Duration approvalTtl,
                                  @Value("${nzila.policy.budget-required:false}") boolean budgetRequired) {
        this.validator = validator;
        this.registry = registry;
        this.policyEngine = policyEngine;
        this.profileStore = profileStore;
        this.budgetService = budgetService;
        this.actionRepository = actionRepository;
        this.auditService = auditService;
        this.clock = clock;
        this.approvalTtl = approvalTtl;
        this.budgetRequired = budgetRequired;
    }

    /**
     * Validates, records and policy-checks a proposal.
     * A denied proposal is returned in POLICY_CHECKED with its DENY decision attached.
     */
    @Transactional
    public Action propose(String actionType, Map<String, Object> payload) {
        ValidatedProposal proposal = validator.validate(actionType, payload);
        ActionTypeDefinition definition = registry.require(actionType);

        Instant now = clock.instant();
        String period = proposal.periodLabel() != null
                ? proposal.periodLabel()
                : YearMonth.from(now.atZone(ZoneOffset.UTC)).toString();

        Action action = actionRepository.save(Action.propose(
                actionType,
                proposal.entityId(),
                proposal.appKey(),
                proposal.profileKey(),
                proposal.canonicalJson(),
                proposal.payloadHash(),
                proposal.dataClass(),
                period,
                proposal.evidencePackEligible(),
                proposal.requestedBy(),
                now));

        Map<String, Object> proposed = new LinkedHashMap<>();
        proposed.put("actionType", actionType);
        proposed.put("proposalHash", proposal.payloadHash());
        proposed.put("periodLabel", period);
        auditService.appendForAction(action.getId(), EventType.ACTION_PROPOSED, proposal.requestedBy(), ActorType.AI, proposed);

        PolicyDecision decision = policyEngine.evaluate(policyInput(proposal, definition, now), definition.policyRule());
        String decisionJson = decision.toCanonicalJson();
        action.recordPolicyCheck(decision.outcome().name(), decisionJson, decision.riskTier(),
                CanonicalJson.write(decision.requiredApproverRoles()), now);
        auditService.appendForAction(action.getId(), EventType.ACTION_POLICY_CHECKED, POLICY_ACTOR, ActorType.SYSTEM,
                CanonicalJson.readMap(decisionJson));

        switch (decision.outcome()) {
            case ALLOW_AUTO -> {
                action.autoApprove(POLICY_ACTOR, now);
                auditService.appendForAction(action.getId(), EventType.ACTION_APPROVED, POLICY_ACTOR, ActorType.SYSTEM,
                        Map.of("automatic", true, "riskTier", decision.riskTier().name()));
                log.info("Action {} ({}) auto-approved", action.getId(), actionType);
            }
            case REQUIRE_APPROVAL -> {
                Instant expiresAt = now.plus(approvalTtl);
                action.requestApproval(expiresAt, now);
                auditService.appendForAction(action.getId(), EventType.ACTION_APPROVAL_REQUESTED, POLICY_ACTOR,
                        ActorType.SYSTEM, Map.of(
                                "requiredApproverRoles", decision.requiredApproverRoles(),
                                "expiresAt", expiresAt.toString(),
                                "riskTier", decision.riskTier().name()));
                log.info("Action {} ({}) awaiting approval by {}", action.getId(), actionType, decision.requiredApproverRoles());
            }
            case DENY -> log.warn("Action {} ({}) denied at {}: {}",
                    action.getId(), actionType, decision.failedCheck(), decision.reasonCode());
        }
        return action;
    }

    /**
     * Re-opens a FAILED action for another execution attempt.
     */
    @Transactional
    public Action retry(UUID actionId, String requestedBy) {
        Action action = actionRepository.findForUpdate(actionId)
                .orElseThrow(() -> new ActionNotFoundException(actionId));
        if (action.getStatus() != ActionStatus.FAILED) {
            throw new ActionStateConflictException(actionId, action.getStatus(),
                    "Only FAILED actions can be retried, action " + actionId + " is " + action.getStatus());
        }
        action.approveRetry(requestedBy, clock.instant());
        auditService.appendForAction(actionId, EventType.ACTION_RETRY_APPROVED, requestedBy, ActorType.HUMAN,
                Map.of("status", action.getStatus().name()));
        log.info("Action {} re-approved for retry by {}", actionId, requestedBy);
        return action;
    }

    @Transactional(readOnly = true)
    public Action getAction(UUID actionId) {
        return actionRepository.findById(actionId).orElseThrow(() -> new ActionNotFoundException(actionId));
    }

    private PolicyInput policyInput(ValidatedProposal proposal, ActionTypeDefinition definition, Instant now) {
        CapabilityProfileSnapshot profile = profileStore
                .find(proposal.entityId(), proposal.appKey(), proposal.profileKey())
                .orElse(null);
        BudgetSnapshot budget = definition.budgetCategory() == null ? null : budgetService
                .snapshot(proposal.entityId(), definition.budgetCategory(), YearMonth.from(now.atZone(ZoneOffset.UTC)).toString())
                .orElse(null);
        return new PolicyInput(proposal, profile, budget, budgetRequired && definition.budgetCategory() != null);
    }
}
