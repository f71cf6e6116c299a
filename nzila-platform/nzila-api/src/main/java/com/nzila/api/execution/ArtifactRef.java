package com.nzila.api.execution;

import com.nzila.core.domain.StoredDocument;

import java.util.UUID;

/**
 * Reference to a stored output of a tool invocation.
 */
public record ArtifactRef(UUID documentId, String path, String category, String contentHash) {

    public static ArtifactRef of(StoredDocument document) {
        return new ArtifactRef(document.getId(), document.getBlobPath(), document.getCategory(), document.getContentHash());
    }
}
