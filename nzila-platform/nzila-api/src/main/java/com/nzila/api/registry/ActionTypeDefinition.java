package com.nzila.api.registry;

import com.nzila.api.execution.ToolAdapter;
import com.nzila.api.policy.ActionPolicyRule;
import com.nzila.api.proposal.ProposalSchema;

/**
 * Everything the engine needs to know about one action type.
 *
 * @param budgetCategory usage budget category charged when the action runs
 */
public record ActionTypeDefinition(
        String key,
        ProposalSchema schema,
        ActionPolicyRule policyRule,
        ToolAdapter adapter,
        String budgetCategory
) {

    public ActionTypeDefinition {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Action type key is required");
        }
        if (schema == null || policyRule == null || adapter == null) {
            throw new IllegalArgumentException("Action type " + key + " needs a schema, a policy rule and an adapter");
        }
    }
}
