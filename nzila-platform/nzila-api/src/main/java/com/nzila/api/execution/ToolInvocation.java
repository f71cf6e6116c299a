package com.nzila.api.execution;

import java.util.Map;
import java.util.UUID;

/**
 * @param proposal the action's canonical proposal, envelope included
 */
public record ToolInvocation(
        UUID actionId,
        UUID runId,
        UUID entityId,
        String actionType,
        String proposalHash,
        Map<String, Object> proposal,
        int attemptNumber,
        String requestedBy
) {

    public String string(String field) {
        Object value = proposal.get(field);
        return value == null ? null : value.toString();
    }

    public int integer(String field) {
        Object value = proposal.get(field);
        if (value instanceof Number number) {
            return number.intValue();
        }
        throw new IllegalArgumentException(field + " is not a number");
    }
}
