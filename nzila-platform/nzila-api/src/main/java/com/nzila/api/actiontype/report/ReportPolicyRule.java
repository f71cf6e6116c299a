package com.nzila.api.actiontype.report;

import com.nzila.api.policy.ActionPolicyRule;
import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.core.domain.Action.RiskTier;

import java.util.List;
import java.util.Set;

/**
 * Report generation only reads data: low risk, unless it covers sensitive or regulated data.
 */
public class ReportPolicyRule implements ActionPolicyRule {

    private static final Set<String> ELEVATED_DATA_CLASSES = Set.of("sensitive", "regulated");

    @Override
    public RiskTier riskTier(ValidatedProposal proposal) {
        return proposal.dataClass() != null && ELEVATED_DATA_CLASSES.contains(proposal.dataClass())
                ? RiskTier.MEDIUM
                : RiskTier.LOW;
    }

    @Override
    public List<String> defaultApproverRoles(RiskTier tier) {
        return tier == RiskTier.HIGH ? List.of("finance_admin") : List.of("finance_manager", "finance_admin");
    }
}
