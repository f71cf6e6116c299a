package com.nzila.api.policy;

import com.nzila.api.proposal.ValidatedProposal;

/**
 * Everything a policy evaluation may depend on.
 *
 * @param profile        capability profile, or {@code null} when none exists
 * @param budget         budget for the action's category and month, or {@code null} when none exists
 * @param budgetRequired deny when no budget exists
 */
public record PolicyInput(
        ValidatedProposal proposal,
        CapabilityProfileSnapshot profile,
        BudgetSnapshot budget,
        boolean budgetRequired
) {}
