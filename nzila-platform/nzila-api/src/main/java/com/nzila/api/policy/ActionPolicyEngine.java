package com.nzila.api.policy;

import com.nzila.api.policy.PolicyDecision.Outcome;
import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.core.domain.Action.RiskTier;
import com.nzila.core.domain.CapabilityProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fail-closed evaluator deciding whether an action may run automatically,
 * needs human approval, or is denied.
 *
 * Checks run in a fixed order and stop at the first failure. The evaluation is a pure
 * function of its {@link PolicyInput}: no clock, no randomness, no I/O. Any exception
 * thrown while evaluating produces a DENY with reason {@value PolicyDecision#EVALUATION_ERROR}.
 */
@Component
public class ActionPolicyEngine {

    private static final Logger log = LoggerFactory.getLogger(ActionPolicyEngine.class);

    private final String policyVersion;

    public ActionPolicyEngine(@Value("${nzila.policy.version:1.0.0}") String policyVersion) {
        this.policyVersion = policyVersion;
    }

    public PolicyDecision evaluate(PolicyInput input, ActionPolicyRule rule) {
        List<PolicyCheck> checks = new ArrayList<>();
        try {
            return evaluateChecks(input, rule, checks);
        } catch (RuntimeException e) {
            log.error("Policy evaluation failed, denying", e);
            checks.add(PolicyCheck.fail(PolicyDecision.EVALUATION_ERROR, e.getClass().getSimpleName()));
            return deny(input, checks, PolicyDecision.EVALUATION_ERROR, PolicyDecision.EVALUATION_ERROR);
        }
    }

    public String getPolicyVersion() {
        return policyVersion;
    }

    private PolicyDecision evaluateChecks(PolicyInput input, ActionPolicyRule rule, List<PolicyCheck> checks) {
        ValidatedProposal proposal = input.proposal();
        CapabilityProfileSnapshot profile = input.profile();

        // 1. Profile exists and is enabled
        if (profile == null) {
            checks.add(PolicyCheck.fail(PolicyCheck.PROFILE_ENABLED, "PROFILE_NOT_FOUND"));
            return deny(input, checks, PolicyCheck.PROFILE_ENABLED, "PROFILE_NOT_FOUND");
        }
        if (!profile.enabled()) {
            checks.add(PolicyCheck.fail(PolicyCheck.PROFILE_ENABLED, "PROFILE_DISABLED"));
            return deny(input, checks, PolicyCheck.PROFILE_ENABLED, "PROFILE_DISABLED");
        }
        checks.add(PolicyCheck.pass(PolicyCheck.PROFILE_ENABLED, "PROFILE_ACTIVE"));

        // 2. Action proposals are switched on for the profile
        if (!profile.features().contains(CapabilityProfile.FEATURE_ACTIONS_PROPOSE)) {
            checks.add(PolicyCheck.fail(PolicyCheck.FEATURE_FLAG, "FEATURE_DISABLED"));
            return deny(input, checks, PolicyCheck.FEATURE_FLAG, "FEATURE_DISABLED");
        }
        checks.add(PolicyCheck.pass(PolicyCheck.FEATURE_FLAG, "FEATURE_ENABLED"));

        // 3. Action type on the tool allow-list
        if (!profile.toolPermissions().contains(proposal.actionType())) {
            checks.add(PolicyCheck.fail(PolicyCheck.ACTION_TYPE_ALLOWED, "ACTION_TYPE_NOT_PERMITTED"));
            return deny(input, checks, PolicyCheck.ACTION_TYPE_ALLOWED, "ACTION_TYPE_NOT_PERMITTED");
        }
        checks.add(PolicyCheck.pass(PolicyCheck.ACTION_TYPE_ALLOWED, "ACTION_TYPE_PERMITTED"));

        // 4. Declared data class permitted
        String dataClass = proposal.dataClass();
        if (dataClass == null) {
            checks.add(PolicyCheck.pass(PolicyCheck.DATA_CLASS_PERMITTED, "NO_DATA_CLASS_DECLARED"));
        } else if (!profile.dataClassesAllowed().contains(dataClass)) {
            checks.add(PolicyCheck.fail(PolicyCheck.DATA_CLASS_PERMITTED, "DATA_CLASS_NOT_PERMITTED"));
            return deny(input, checks, PolicyCheck.DATA_CLASS_PERMITTED, "DATA_CLASS_NOT_PERMITTED");
        } else {
            checks.add(PolicyCheck.pass(PolicyCheck.DATA_CLASS_PERMITTED, "DATA_CLASS_ALLOWED"));
        }

        // 5. Budget not exhausted
        BudgetSnapshot budget = input.budget();
        if (budget == null) {
            if (input.budgetRequired()) {
                checks.add(PolicyCheck.fail(PolicyCheck.BUDGET_AVAILABLE, "BUDGET_MISSING"));
                return deny(input, checks, PolicyCheck.BUDGET_AVAILABLE, "BUDGET_MISSING");
            }
            checks.add(PolicyCheck.pass(PolicyCheck.BUDGET_AVAILABLE, "NO_BUDGET_CONFIGURED"));
        } else {
            switch (budget.status()) {
                case BLOCKED -> {
                    checks.add(PolicyCheck.fail(PolicyCheck.BUDGET_AVAILABLE, "BUDGET_BLOCKED"));
                    return deny(input, checks, PolicyCheck.BUDGET_AVAILABLE, "BUDGET_BLOCKED");
                }
                case WARNING -> checks.add(PolicyCheck.pass(PolicyCheck.BUDGET_AVAILABLE, "BUDGET_WARNING"));
                case OK -> checks.add(PolicyCheck.pass(PolicyCheck.BUDGET_AVAILABLE, "BUDGET_OK"));
            }
        }

        // 6. Risk tier decides between auto-approval and human approval
        RiskTier tier = rule.riskTier(proposal);
        if (tier == null) {
            throw new IllegalStateException("Policy rule returned no risk tier for " + proposal.actionType());
        }
        if (tier == RiskTier.LOW && profile.autoApproveActionTypes().contains(proposal.actionType())) {
            checks.add(PolicyCheck.pass(PolicyCheck.RISK_TIER, "AUTO_APPROVE_LOW_RISK"));
            return decision(Outcome.ALLOW_AUTO, input, checks, null, "AUTO_APPROVED", tier, List.of());
        }

        List<String> roles = profile.approverRoles().get(tier.name().toLowerCase(Locale.ROOT));
        if (roles == null || roles.isEmpty()) {
            roles = rule.defaultApproverRoles(tier);
        }
        if (roles == null || roles.isEmpty()) {
            checks.add(PolicyCheck.fail(PolicyCheck.RISK_TIER, "NO_APPROVER_ROLES"));
            return decision(Outcome.DENY, input, checks, PolicyCheck.RISK_TIER, "NO_APPROVER_ROLES", tier, List.of());
        }
        checks.add(PolicyCheck.pass(PolicyCheck.RISK_TIER, "APPROVAL_REQUIRED_" + tier.name()));
        return decision(Outcome.REQUIRE_APPROVAL, input, checks, null, "APPROVAL_REQUIRED", tier,
                roles.stream().distinct().sorted().toList());
    }

    private PolicyDecision deny(PolicyInput input, List<PolicyCheck> checks, String failedCheck, String reasonCode) {
        return decision(Outcome.DENY, input, checks, failedCheck, reasonCode, null, List.of());
    }

    private PolicyDecision decision(Outcome outcome, PolicyInput input, List<PolicyCheck> checks,
                                    String failedCheck, String reasonCode, RiskTier tier, List<String> roles) {
        ValidatedProposal proposal = input == null ? null : input.proposal();
        return new PolicyDecision(
                outcome,
                List.copyOf(checks),
                failedCheck,
                reasonCode,
                tier,
                roles,
                policyVersion,
                proposal == null ? null : proposal.actionType(),
                proposal == null ? null : proposal.payloadHash());
    }
}
