package com.nzila.core.repository;

import com.nzila.core.domain.StoredDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface StoredDocumentRepository extends JpaRepository<StoredDocument, UUID> {

    Optional<StoredDocument> findByBlobPath(String blobPath);

    List<StoredDocument> findByActionIdIn(Collection<UUID> actionIds);

    List<StoredDocument> findByRunIdAndCategory(UUID runId, String category);
}
