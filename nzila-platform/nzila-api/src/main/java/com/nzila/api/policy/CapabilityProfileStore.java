package com.nzila.api.policy;

import java.util.Optional;
import java.util.UUID;

/**
 * Source of capability profiles for policy evaluation.
 */
public interface CapabilityProfileStore {

    Optional<CapabilityProfileSnapshot> find(UUID entityId, String appKey, String profileKey);
}
