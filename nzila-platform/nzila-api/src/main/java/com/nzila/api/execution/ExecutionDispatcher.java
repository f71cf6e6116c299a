package com.nzila.api.execution;

import com.nzila.api.action.ActionStateConflictException;
import com.nzila.api.action.ConflictTranslator;
import com.nzila.api.execution.ExecutionRecorder.RunStart;
import com.nzila.api.registry.ActionTypeDefinition;
import com.nzila.api.registry.ActionTypeRegistry;
import com.nzila.core.domain.Action;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.hash.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs approved actions through their tool adapter.
 *
 * Exclusivity per action comes from three layers: an in-process try-lock, the action row lock
 * taken by {@link ExecutionRecorder#beginRun}, and the single STARTED run check. The adapter runs
 * on the tool worker pool, bounded by {@code nzila.execution.tool-timeout}. Every outcome,
 * including a timeout, ends in a finalized run; the in-process lock is released on every path.
 */
@Service
public class ExecutionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ExecutionDispatcher.class);

    static final String REASON_TOOL_ERROR = "TOOL_ERROR";
    static final String REASON_TIMEOUT = "TOOL_TIMEOUT";
    static final String REASON_PREPARATION_ERROR = "PREPARATION_ERROR";
    static final String REASON_COMPLETION_ERROR = "COMPLETION_ERROR";

    private final ActionTypeRegistry registry;
    private final ExecutionRecorder recorder;
    private final ExecutionLockRegistry lockRegistry;
    private final TraceSanitizer sanitizer;
    private final ExecutorService toolExecutor;
    private final Duration toolTimeout;

    public ExecutionDispatcher(ActionTypeRegistry registry,
                               ExecutionRecorder recorder,
                               ExecutionLockRegistry lockRegistry,
                               TraceSanitizer sanitizer,
                               @Qualifier("toolExecutor") ExecutorService toolExecutor,
                               @Value("${nzila.execution.tool-timeout:PT30S}") Duration toolTimeout) {
        this.registry = registry;
        this.recorder = recorder;
        this.lockRegistry = lockRegistry;
        this.sanitizer = sanitizer;
        this.toolExecutor = toolExecutor;
        this.toolTimeout = toolTimeout;
    }

    /**
     * Executes an APPROVED action and returns its finalized run.
     * Tool failures and timeouts are returned as a FAILED run, not thrown.
     *
     * @throws ActionStateConflictException when the action is not APPROVED or is already executing
     */
    public ActionRun execute(UUID actionId, String requestedBy) {
        if (!lockRegistry.tryAcquire(actionId)) {
            throw new ActionStateConflictException(actionId, null, "Action " + actionId + " is already executing");
        }
        MDC.put("actionId", actionId.toString());
        try {
            RunStart start = ConflictTranslator.translate(actionId, () -> recorder.beginRun(actionId, requestedBy));
            Action action = start.action();
            ActionRun run = start.run();

            ActionTypeDefinition definition;
            ToolInvocation invocation;
            try {
                definition = registry.require(action.getActionType());
                invocation = new ToolInvocation(
                        actionId,
                        run.getId(),
                        action.getEntityId(),
                        action.getActionType(),
                        action.getProposalHash(),
                        CanonicalJson.readMap(action.getProposalJson()),
                        run.getAttemptNumber(),
                        requestedBy);
            } catch (RuntimeException e) {
                log.error("Preparing run {} of action {} failed", run.getId(), actionId, e);
                return finishFailed(actionId, run.getId(), "Preparation failed: " + describe(e), REASON_PREPARATION_ERROR);
            }

            ToolResult result;
            try {
                result = invokeWithTimeout(definition.adapter(), invocation);
            } catch (ToolTimeoutException e) {
                return finishFailed(actionId, run.getId(), e.getMessage(), REASON_TIMEOUT);
            } catch (ToolExecutionException e) {
                return finishFailed(actionId, run.getId(), e.getMessage(), REASON_TOOL_ERROR);
            }

            List<Map<String, Object>> trace = sanitizer.sanitize(result.toolCalls());
            try {
                return ConflictTranslator.translate(actionId,
                        () -> recorder.completeRun(run.getId(), result, trace, definition.budgetCategory()));
            } catch (ActionStateConflictException e) {
                throw e;
            } catch (RuntimeException e) {
                log.error("Completing run {} of action {} failed", run.getId(), actionId, e);
                return ConflictTranslator.translate(actionId,
                        () -> recorder.failRun(run.getId(), "Completion failed: " + describe(e), trace, REASON_COMPLETION_ERROR));
            }
        } finally {
            lockRegistry.release(actionId);
            MDC.remove("actionId");
        }
    }

    private ActionRun finishFailed(UUID actionId, UUID runId, String error, String reason) {
        return ConflictTranslator.translate(actionId, () -> recorder.failRun(runId, error, List.of(), reason));
    }

    private ToolResult invokeWithTimeout(ToolAdapter adapter, ToolInvocation invocation) {
        Future<ToolResult> future = toolExecutor.submit(() -> adapter.invoke(invocation));
        try {
            ToolResult result = future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                throw new ToolExecutionException("Tool " + invocation.actionType() + " returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool {} timed out after {} for action {}", invocation.actionType(), toolTimeout, invocation.actionId());
            throw new ToolTimeoutException("Tool execution timed out after " + toolTimeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("Tool {} failed for action {}: {}", invocation.actionType(), invocation.actionId(), describe(cause));
            throw new ToolExecutionException(describe(cause), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolExecutionException("Interrupted while waiting for tool " + invocation.actionType(), e);
        }
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    static class ToolTimeoutException extends ToolExecutionException {
        ToolTimeoutException(String message) { super(message); }
    }
}
