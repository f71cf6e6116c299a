package com.nzila.core.domain;

/**
 * Thrown by lifecycle entities when a transition is not allowed from the current state.
 */
public class IllegalActionTransitionException extends IllegalStateException {

    private final String currentState;
    private final String attemptedState;

    public IllegalActionTransitionException(String currentState, String attemptedState) {
        super("Illegal transition from " + currentState + " to " + attemptedState);
        this.currentState = currentState;
        this.attemptedState = attemptedState;
    }

    public IllegalActionTransitionException(String message) {
        super(message);
        this.currentState = null;
        this.attemptedState = null;
    }

    public String getCurrentState() { return currentState; }
    public String getAttemptedState() { return attemptedState; }
}
