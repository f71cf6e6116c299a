package com.nzila.api.action;

import com.nzila.core.domain.Action.ActionStatus;

import java.util.UUID;

/**
 * The requested operation does not fit the action's current state, or lost a race
 * against a concurrent operation on the same action.
 */
public class ActionStateConflictException extends RuntimeException {

    private final UUID actionId;
    private final ActionStatus currentStatus;

    public ActionStateConflictException(UUID actionId, ActionStatus currentStatus, String message) {
        super(message);
        this.actionId = actionId;
        this.currentStatus = currentStatus;
    }

    public ActionStateConflictException(UUID actionId, String message, Throwable cause) {
        super(message, cause);
        this.actionId = actionId;
        this.currentStatus = null;
    }

    public UUID getActionId() { return actionId; }
    public ActionStatus getCurrentStatus() { return currentStatus; }
}
