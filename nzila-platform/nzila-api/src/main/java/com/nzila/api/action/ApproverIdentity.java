package com.nzila.api.action;

import java.util.List;
import java.util.Set;

/**
 * Who is deciding on an action, and the roles they hold.
 */
public record ApproverIdentity(String id, Set<String> roles) {

    public ApproverIdentity {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Approver id is required");
        }
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public boolean holdsAnyOf(List<String> required) {
        return required.stream().anyMatch(roles::contains);
    }
}
