package com.nzila.api.execution;

import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process, non-blocking exclusivity per action id.
 */
@Component
public class ExecutionLockRegistry {

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

    /**
     * @return false when another execution of the action holds the lock
     */
    public boolean tryAcquire(UUID actionId) {
        return inFlight.add(actionId);
    }

    public void release(UUID actionId) {
        inFlight.remove(actionId);
    }

    public boolean isHeld(UUID actionId) {
        return inFlight.contains(actionId);
    }
}
