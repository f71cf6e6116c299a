package com.nzila.api.policy;

import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.core.domain.Action.RiskTier;

import java.util.List;

/**
 * Type-specific part of policy evaluation. Implementations must be pure.
 */
public interface ActionPolicyRule {

    RiskTier riskTier(ValidatedProposal proposal);

    /**
     * Approver roles used when the capability profile names none for the tier.
     */
    List<String> defaultApproverRoles(RiskTier tier);
}
