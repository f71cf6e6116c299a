package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Progress record for one knowledge ingestion: QUEUED, CHUNKED, EMBEDDED, STORED, or FAILED.
 */
@Entity
@Table(name = "ai_knowledge_ingestion_runs", indexes = {
    @Index(name = "idx_ai_ingestion_source", columnList = "entity_id, source_id, content_hash"),
    @Index(name = "idx_ai_ingestion_action", columnList = "action_id")
})
public class KnowledgeIngestionRun {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @Column(name = "action_id")
    private UUID actionId;

    @NotNull
    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @NotNull
    @Column(nullable = false, length = 300)
    private String title;

    @NotNull
    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IngestionStatus status;

    @Column(name = "chunk_count", nullable = false)
    private int chunkCount;

    @Column(name = "embedding_count", nullable = false)
    private int embeddingCount;

    @Column(name = "character_count", nullable = false)
    private long characterCount;

    @Column(name = "manifest_document_id")
    private UUID manifestDocumentId;

    @Column(name = "manifest_path", length = 500)
    private String manifestPath;

    @Column(columnDefinition = "TEXT")
    private String error;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    protected KnowledgeIngestionRun() {}

    public static KnowledgeIngestionRun queue(UUID entityId, UUID actionId, UUID sourceId, String title,
                                              String contentHash, long characterCount, Instant now) {
        var run = new KnowledgeIngestionRun();
        run.entityId = entityId;
        run.actionId = actionId;
        run.sourceId = sourceId;
        run.title = title;
        run.contentHash = contentHash;
        run.characterCount = characterCount;
        run.status = IngestionStatus.QUEUED;
        run.createdAt = now;
        run.updatedAt = now;
        return run;
    }

    public void markChunked(int chunkCount, Instant now) {
        advance(IngestionStatus.QUEUED, IngestionStatus.CHUNKED, now);
        this.chunkCount = chunkCount;
    }

    public void markEmbedded(int embeddingCount, Instant now) {
        advance(IngestionStatus.CHUNKED, IngestionStatus.EMBEDDED, now);
        this.embeddingCount = embeddingCount;
    }

    public void markStored(UUID manifestDocumentId, String manifestPath, Instant now) {
        advance(IngestionStatus.EMBEDDED, IngestionStatus.STORED, now);
        this.manifestDocumentId = manifestDocumentId;
        this.manifestPath = manifestPath;
    }

    public void markFailed(String error, Instant now) {
        if (status == IngestionStatus.STORED || status == IngestionStatus.FAILED) {
            throw new IllegalActionTransitionException(status.name(), IngestionStatus.FAILED.name());
        }
        this.status = IngestionStatus.FAILED;
        this.error = error;
        this.updatedAt = now;
    }

    private void advance(IngestionStatus expected, IngestionStatus target, Instant now) {
        if (status != expected) {
            throw new IllegalActionTransitionException(status.name(), target.name());
        }
        this.status = target;
        this.updatedAt = now;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getEntityId() { return entityId; }
    public UUID getActionId() { return actionId; }
    public UUID getSourceId() { return sourceId; }
    public String getTitle() { return title; }
    public String getContentHash() { return contentHash; }
    public IngestionStatus getStatus() { return status; }
    public int getChunkCount() { return chunkCount; }
    public int getEmbeddingCount() { return embeddingCount; }
    public long getCharacterCount() { return characterCount; }
    public UUID getManifestDocumentId() { return manifestDocumentId; }
    public String getManifestPath() { return manifestPath; }
    public String getError() { return error; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum IngestionStatus {
        QUEUED,
        CHUNKED,
        EMBEDDED,
        STORED,
        FAILED
    }
}
