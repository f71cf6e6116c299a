package com.nzila.api.execution;

import java.util.Map;

/**
 * One step a tool performed, recorded in the run trace after sanitization.
 */
public record ToolCall(String tool, Map<String, Object> input, Map<String, Object> output, long durationMs) {}
