package com.nzila.api.registry;

public class UnknownActionTypeException extends RuntimeException {

    private final String actionType;

    public UnknownActionTypeException(String actionType) {
        super("Unknown action type: " + actionType);
        this.actionType = actionType;
    }

    public String getActionType() { return actionType; }
}
