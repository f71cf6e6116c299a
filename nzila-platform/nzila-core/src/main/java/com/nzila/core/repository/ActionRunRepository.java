package com.nzila.core.repository;

import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.ActionRun.RunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface ActionRunRepository extends JpaRepository<ActionRun, UUID> {

    List<ActionRun> findByActionIdOrderByAttemptNumberAsc(UUID actionId);

    @Query("SELECT r FROM ActionRun r WHERE r.actionId IN :actionIds ORDER BY r.startedAt, r.attemptNumber")
    List<ActionRun> findByActionIds(@Param("actionIds") Collection<UUID> actionIds);

    boolean existsByActionIdAndStatus(UUID actionId, RunStatus status);

    long countByActionId(UUID actionId);

    /**
     * Runs stuck in STARTED since before the cutoff, oldest first.
     */
    @Query("SELECT r.id FROM ActionRun r WHERE r.status = 'STARTED' AND r.startedAt < :cutoff ORDER BY r.startedAt")
    List<UUID> findStaleRunIds(@Param("cutoff") Instant cutoff);
}
