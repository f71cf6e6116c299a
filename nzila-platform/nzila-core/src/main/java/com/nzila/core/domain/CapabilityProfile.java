package com.nzila.core.domain;

import com.nzila.core.hash.CanonicalJson;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Per entity/app/profile configuration of what automated actions are allowed.
 * List and map attributes are stored as canonical JSON text.
 */
@Entity
@Table(name = "ai_capability_profiles", uniqueConstraints = {
    @UniqueConstraint(name = "uq_ai_capability_profiles_key",
            columnNames = {"entity_id", "app_key", "profile_key", "environment"})
})
public class CapabilityProfile {

    public static final String FEATURE_ACTIONS_PROPOSE = "actions_propose";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @NotNull
    @Column(name = "app_key", nullable = false, length = 120)
    private String appKey;

    @NotNull
    @Column(name = "profile_key", nullable = false, length = 120)
    private String profileKey;

    @NotNull
    @Column(nullable = false, length = 30)
    private String environment;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "features_json", columnDefinition = "TEXT")
    private String featuresJson;

    @Column(name = "data_classes_allowed_json", columnDefinition = "TEXT")
    private String dataClassesAllowedJson;

    @Column(name = "tool_permissions_json", columnDefinition = "TEXT")
    private String toolPermissionsJson;

    @Column(name = "auto_approve_action_types_json", columnDefinition = "TEXT")
    private String autoApproveActionTypesJson;

    /**
     * JSON object: risk tier name to list of approver roles.
     */
    @Column(name = "approver_roles_json", columnDefinition = "TEXT")
    private String approverRolesJson;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected CapabilityProfile() {}

    public static CapabilityProfile create(
            UUID entityId,
            String appKey,
            String profileKey,
            String environment,
            List<String> features,
            List<String> dataClassesAllowed,
            List<String> toolPermissions,
            List<String> autoApproveActionTypes,
            Map<String, List<String>> approverRoles,
            Instant now) {

        var profile = new CapabilityProfile();
        profile.entityId = entityId;
        profile.appKey = appKey;
        profile.profileKey = profileKey;
        profile.environment = environment;
        profile.enabled = true;
        profile.featuresJson = CanonicalJson.write(features);
        profile.dataClassesAllowedJson = CanonicalJson.write(dataClassesAllowed);
        profile.toolPermissionsJson = CanonicalJson.write(toolPermissions);
        profile.autoApproveActionTypesJson = CanonicalJson.write(autoApproveActionTypes);
        profile.approverRolesJson = CanonicalJson.write(new TreeMap<>(approverRoles));
        profile.createdAt = now;
        profile.updatedAt = now;
        return profile;
    }

    public void disable(Instant now) {
        this.enabled = false;
        this.updatedAt = now;
    }

    public void enable(Instant now) {
        this.enabled = true;
        this.updatedAt = now;
    }

    public List<String> features() { return stringList(featuresJson); }
    public List<String> dataClassesAllowed() { return stringList(dataClassesAllowedJson); }
    public List<String> toolPermissions() { return stringList(toolPermissionsJson); }
    public List<String> autoApproveActionTypes() { return stringList(autoApproveActionTypesJson); }

    public Map<String, List<String>> approverRoles() {
        Map<String, List<String>> roles = new LinkedHashMap<>();
        CanonicalJson.readMap(approverRolesJson).forEach((tier, value) -> {
            List<String> names = new ArrayList<>();
            if (value instanceof List<?> list) {
                list.forEach(item -> names.add(String.valueOf(item)));
            }
            roles.put(tier, List.copyOf(names));
        });
        return roles;
    }

    private static List<String> stringList(String json) {
        List<String> values = new ArrayList<>();
        CanonicalJson.readList(json).forEach(item -> values.add(String.valueOf(item)));
        return List.copyOf(values);
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getEntityId() { return entityId; }
    public String getAppKey() { return appKey; }
    public String getProfileKey() { return profileKey; }
    public String getEnvironment() { return environment; }
    public boolean isEnabled() { return enabled; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
}
