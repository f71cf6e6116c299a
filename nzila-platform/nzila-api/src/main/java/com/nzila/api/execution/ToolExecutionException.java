package com.nzila.api.execution;

public class ToolExecutionException extends RuntimeException {
    public ToolExecutionException(String message) { super(message); }
    public ToolExecutionException(String message, Throwable cause) { super(message, cause); }
}
