package com.nzila.api.policy;

import com.nzila.core.domain.CapabilityProfile;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable view of a capability profile at evaluation time.
 */
public record CapabilityProfileSnapshot(
        UUID entityId,
        String appKey,
        String profileKey,
        boolean enabled,
        List<String> features,
        List<String> dataClassesAllowed,
        List<String> toolPermissions,
        List<String> autoApproveActionTypes,
        Map<String, List<String>> approverRoles
) {

    public static CapabilityProfileSnapshot of(CapabilityProfile profile) {
        return new CapabilityProfileSnapshot(
                profile.getEntityId(),
                profile.getAppKey(),
                profile.getProfileKey(),
                profile.isEnabled(),
                profile.features(),
                profile.dataClassesAllowed(),
                profile.toolPermissions(),
                profile.autoApproveActionTypes(),
                profile.approverRoles());
    }
}
