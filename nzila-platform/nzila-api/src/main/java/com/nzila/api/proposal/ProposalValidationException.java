package com.nzila.api.proposal;

import java.util.List;

/**
 * Rejects a malformed proposal. Carries every violation found, not just the first.
 */
public class ProposalValidationException extends RuntimeException {

    private final String actionType;
    private final List<FieldViolation> violations;

    public ProposalValidationException(String actionType, List<FieldViolation> violations) {
        super("Invalid proposal for " + actionType + ": " + violations.size() + " violation(s)");
        this.actionType = actionType;
        this.violations = List.copyOf(violations);
    }

    public String getActionType() { return actionType; }
    public List<FieldViolation> getViolations() { return violations; }
}
