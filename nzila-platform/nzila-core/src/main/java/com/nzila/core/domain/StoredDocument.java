package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.UUID;

/**
 * Metadata row for a blob written by the engine (attestations, generated reports,
 * knowledge manifests). The content hash is the SHA-256 of the stored bytes.
 */
@Entity
@Table(name = "documents", indexes = {
    @Index(name = "idx_documents_entity", columnList = "entity_id"),
    @Index(name = "idx_documents_run", columnList = "run_id"),
    @Index(name = "idx_documents_action", columnList = "action_id")
}, uniqueConstraints = {
    @UniqueConstraint(name = "uq_documents_blob_path", columnNames = "blob_path")
})
public class StoredDocument {

    public static final String CATEGORY_ATTESTATION = "ai_attestation";
    public static final String CATEGORY_REPORT = "ai_report";
    public static final String CATEGORY_KNOWLEDGE_MANIFEST = "ai_knowledge_manifest";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @NotNull
    @Column(nullable = false, length = 60)
    private String category;

    @NotNull
    @Column(name = "blob_path", nullable = false, length = 500)
    private String blobPath;

    @NotNull
    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "size_bytes", nullable = false)
    private long sizeBytes;

    @NotNull
    @Column(name = "content_type", nullable = false, length = 100)
    private String contentType;

    @Column(name = "action_id")
    private UUID actionId;

    @Column(name = "run_id")
    private UUID runId;

    @NotNull
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected StoredDocument() {}

    public static StoredDocument create(
            UUID entityId,
            String category,
            String blobPath,
            String contentHash,
            long sizeBytes,
            String contentType,
            UUID actionId,
            UUID runId,
            Instant now) {

        var document = new StoredDocument();
        document.entityId = entityId;
        document.category = category;
        document.blobPath = blobPath;
        document.contentHash = contentHash;
        document.sizeBytes = sizeBytes;
        document.contentType = contentType;
        document.actionId = actionId;
        document.runId = runId;
        document.createdAt = now;
        return document;
    }

    /**
     * Points the row at rewritten content after its blob was found damaged or missing.
     */
    public void replaceContent(String contentHash, long sizeBytes, String contentType, UUID actionId, UUID runId) {
        this.contentHash = contentHash;
        this.sizeBytes = sizeBytes;
        this.contentType = contentType;
        this.actionId = actionId;
        this.runId = runId;
    }

    public UUID getId() { return id; }
    public UUID getEntityId() { return entityId; }
    public String getCategory() { return category; }
    public String getBlobPath() { return blobPath; }
    public String getContentHash() { return contentHash; }
    public long getSizeBytes() { return sizeBytes; }
    public String getContentType() { return contentType; }
    public UUID getActionId() { return actionId; }
    public UUID getRunId() { return runId; }
    public Instant getCreatedAt() { return createdAt; }
}
