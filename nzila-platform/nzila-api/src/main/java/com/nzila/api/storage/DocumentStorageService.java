package com.nzila.api.storage;

import com.nzila.core.domain.StoredDocument;
import com.nzila.core.hash.ContentHashing;
import com.nzila.core.repository.StoredDocumentRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * Writes a blob and its {@code documents} row together. A row whose blob no longer
 * matches its recorded hash is rewritten in place rather than duplicated.
 */
@Service
public class DocumentStorageService {

    private static final Logger log = LoggerFactory.getLogger(DocumentStorageService.class);

    private final DocumentBlobStore blobStore;
    private final StoredDocumentRepository documentRepository;
    private final Clock clock;

    public DocumentStorageService(DocumentBlobStore blobStore,
                                  StoredDocumentRepository documentRepository,
                                  Clock clock) {
        this.blobStore = blobStore;
        this.documentRepository = documentRepository;
        this.clock = clock;
    }

    @Transactional
    public StoredDocument store(UUID entityId, String category, String path, byte[] content,
                                String contentType, UUID actionId, UUID runId) {
        String contentHash = ContentHashing.sha256(content);
        Optional<StoredDocument> recorded = documentRepository.findByBlobPath(path);
        if (recorded.isPresent()) {
            StoredDocument existing = recorded.get();
            if (isIntact(existing)) {
                throw new BlobStoreException("Document already recorded at " + path);
            }
            if (!existing.getCategory().equals(category)) {
                throw new BlobStoreException("Document at " + path + " is recorded as " + existing.getCategory());
            }
            blobStore.put(path, content);
            existing.replaceContent(contentHash, content.length, contentType, actionId, runId);
            StoredDocument rewritten = documentRepository.save(existing);
            log.warn("Rewrote damaged {} document {} at {}", category, rewritten.getId(), path);
            return rewritten;
        }
        blobStore.put(path, content);
        StoredDocument document = documentRepository.save(StoredDocument.create(
                entityId, category, path, contentHash, content.length,
                contentType, actionId, runId, clock.instant()));
        log.info("Stored {} document {} at {}", category, document.getId(), path);
        return document;
    }

    /**
     * Returns the document at a path only when both the row and an intact blob exist.
     */
    @Transactional(readOnly = true)
    public Optional<StoredDocument> findIntact(String path) {
        return documentRepository.findByBlobPath(path).filter(this::isIntact);
    }

    public Optional<byte[]> read(String path) {
        return blobStore.get(path);
    }

    private boolean isIntact(StoredDocument document) {
        return blobStore.get(document.getBlobPath())
                .map(bytes -> ContentHashing.matches(document.getContentHash(), ContentHashing.sha256(bytes)))
                .orElse(false);
    }
}
