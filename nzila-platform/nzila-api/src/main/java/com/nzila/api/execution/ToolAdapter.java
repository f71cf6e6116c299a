package com.nzila.api.execution;

/**
 * Performs the work behind one action type.
 *
 * Implementations must be check-then-act idempotent: invoking again for the same logical work
 * finds and returns the artifacts of the first successful invocation instead of repeating
 * side effects.
 */
public interface ToolAdapter {

    ToolResult invoke(ToolInvocation invocation) throws ToolExecutionException;
}
