package com.nzila.api.action;

import java.util.List;
import java.util.UUID;

public class ApproverNotAuthorizedException extends RuntimeException {

    private final List<String> requiredRoles;

    public ApproverNotAuthorizedException(UUID actionId, String approver, List<String> requiredRoles) {
        super("Approver " + approver + " holds none of the roles " + requiredRoles + " required for action " + actionId);
        this.requiredRoles = List.copyOf(requiredRoles);
    }

    public List<String> getRequiredRoles() { return requiredRoles; }
}
