package com.nzila.api.action;

import java.util.UUID;

public class ActionNotFoundException extends RuntimeException {
    public ActionNotFoundException(UUID actionId) { super("Action not found: " + actionId); }
}
