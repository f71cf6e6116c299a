package com.nzila.api.policy;

import com.nzila.core.repository.CapabilityProfileRepository;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Looks profiles up in {@code ai_capability_profiles} for the configured environment.
 */
@Component
public class JpaCapabilityProfileStore implements CapabilityProfileStore {

    private final CapabilityProfileRepository repository;
    private final String environment;

    public JpaCapabilityProfileStore(
            CapabilityProfileRepository repository,
            @Value("${nzila.environment:dev}") String environment) {
        this.repository = repository;
        this.environment = environment;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CapabilityProfileSnapshot> find(UUID entityId, String appKey, String profileKey) {
        return repository.findByEntityIdAndAppKeyAndProfileKeyAndEnvironment(entityId, appKey, profileKey, environment)
                .map(CapabilityProfileSnapshot::of);
    }
}
