package com.nzila.core.repository;

import com.nzila.core.domain.Action;
import com.nzila.core.domain.Action.ActionStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for actions. Every lifecycle transition loads the row through
 * {@link #findForUpdate(UUID)} so that concurrent transitions serialize on the row lock.
 */
@Repository
public interface ActionRepository extends JpaRepository<Action, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM Action a WHERE a.id = :id")
    Optional<Action> findForUpdate(@Param("id") UUID id);

    /**
     * Ids of awaiting actions whose approval window has elapsed.
     */
    @Query("SELECT a.id FROM Action a WHERE a.status = :status AND a.expiresAt <= :now ORDER BY a.expiresAt")
    List<UUID> findIdsByStatusExpiringBefore(@Param("status") ActionStatus status, @Param("now") Instant now);

    @Query("SELECT a FROM Action a WHERE a.entityId = :entityId AND a.periodLabel = :period " +
           "AND a.evidencePackEligible = true ORDER BY a.proposedAt, a.id")
    List<Action> findEvidenceEligible(@Param("entityId") UUID entityId, @Param("period") String period);

    List<Action> findByEntityIdAndStatus(UUID entityId, ActionStatus status);

    List<Action> findByEntityIdAndPeriodLabelOrderByProposedAtAsc(UUID entityId, String periodLabel);

    long countByStatus(ActionStatus status);
}
