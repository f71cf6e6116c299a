package com.nzila.api.proposal;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Type-specific part of a proposal. Envelope fields are handled by {@link ProposalValidator}.
 */
public interface ProposalSchema {

    /**
     * Field names this schema reads; anything else outside the envelope is rejected.
     */
    Set<String> fieldNames();

    /**
     * Reads and normalizes the type-specific fields, applying defaults.
     * Problems are recorded on the reader, never thrown.
     */
    Map<String, Object> normalize(FieldReader reader);

    /**
     * The period (YYYY-MM) a proposal belongs to, when the payload names one.
     */
    default Optional<String> periodLabel(Map<String, Object> normalized) {
        return Optional.empty();
    }

    default boolean requiresDataClass() {
        return false;
    }
}
