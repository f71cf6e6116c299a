package com.nzila.api.proposal;

import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * A proposal that passed validation, with defaults applied.
 *
 * @param fields        normalized type-specific fields
 * @param canonicalJson canonical serialization of envelope and fields
 * @param payloadHash   SHA-256 of {@code canonicalJson}
 */
public record ValidatedProposal(
        String actionType,
        UUID entityId,
        String appKey,
        String profileKey,
        String requestedBy,
        String dataClass,
        boolean evidencePackEligible,
        Map<String, Object> fields,
        String periodLabel,
        String canonicalJson,
        String payloadHash
) {

    public Optional<String> dataClassIfDeclared() {
        return Optional.ofNullable(dataClass);
    }

    public Object field(String name) {
        return fields.get(name);
    }
}
