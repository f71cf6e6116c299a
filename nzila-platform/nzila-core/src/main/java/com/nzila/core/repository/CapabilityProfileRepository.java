package com.nzila.core.repository;

import com.nzila.core.domain.CapabilityProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CapabilityProfileRepository extends JpaRepository<CapabilityProfile, UUID> {

    Optional<CapabilityProfile> findByEntityIdAndAppKeyAndProfileKeyAndEnvironment(
            UUID entityId, String appKey, String profileKey, String environment);
}
