package com.nzila.core.repository;

import com.nzila.core.domain.KnowledgeIngestionRun;
import com.nzila.core.domain.KnowledgeIngestionRun.IngestionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface KnowledgeIngestionRunRepository extends JpaRepository<KnowledgeIngestionRun, UUID> {

    Optional<KnowledgeIngestionRun> findFirstByEntityIdAndSourceIdAndContentHashAndStatusOrderByCreatedAtAsc(
            UUID entityId, UUID sourceId, String contentHash, IngestionStatus status);

    List<KnowledgeIngestionRun> findByActionIdIn(Collection<UUID> actionIds);
}
