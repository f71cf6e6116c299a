package com.nzila.core.repository;

import com.nzila.core.domain.AuditEvent;
import com.nzila.core.domain.AuditEvent.EventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read and append access to the ledger. Nothing here updates or deletes events.
 */
@Repository
public interface AuditEventRepository extends JpaRepository<AuditEvent, UUID> {

    List<AuditEvent> findByTargetIdOrderBySequenceAsc(UUID targetId);

    Optional<AuditEvent> findTopByTargetIdOrderBySequenceDesc(UUID targetId);

    List<AuditEvent> findByTargetIdAndEventTypeOrderBySequenceAsc(UUID targetId, EventType eventType);

    long countByTargetId(UUID targetId);

    long countByTargetIdAndEventType(UUID targetId, EventType eventType);
}
