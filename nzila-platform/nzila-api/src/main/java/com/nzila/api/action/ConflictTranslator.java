package com.nzila.api.action;

import com.nzila.core.domain.IllegalActionTransitionException;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Turns database-level races and illegal transitions on one action into
 * {@link ActionStateConflictException}.
 */
public final class ConflictTranslator {

    private ConflictTranslator() {
    }

    public static <T> T translate(UUID actionId, Supplier<T> work) {
        try {
            return work.get();
        } catch (IllegalActionTransitionException e) {
            throw new ActionStateConflictException(actionId, e.getMessage(), e);
        } catch (ConcurrencyFailureException e) {
            throw new ActionStateConflictException(actionId, "Concurrent modification of action " + actionId, e);
        } catch (DataIntegrityViolationException e) {
            throw new ActionStateConflictException(actionId, "Ledger append for action " + actionId + " lost a race", e);
        }
    }
}
