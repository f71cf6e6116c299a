package com.nzila.api.execution;

import java.math.BigDecimal;
import java.util.List;

/**
 * @param cost amount charged to the action type's usage budget, zero when free
 */
public record ToolResult(List<ArtifactRef> artifacts, List<ToolCall> toolCalls, BigDecimal cost) {

    public ToolResult {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        cost = cost == null ? BigDecimal.ZERO : cost;
    }
}
