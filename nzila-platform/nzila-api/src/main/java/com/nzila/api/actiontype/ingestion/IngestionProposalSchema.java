package com.nzila.api.actiontype.ingestion;

import com.nzila.api.proposal.FieldReader;
import com.nzila.api.proposal.FieldViolation;
import com.nzila.api.proposal.ProposalSchema;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Payload of {@code knowledge.ingest}. A data class is mandatory for ingestion.
 */
public class IngestionProposalSchema implements ProposalSchema {

    public static final String SOURCE_ID = "sourceId";
    public static final String TITLE = "title";
    public static final String CONTENT = "content";
    public static final String CHUNK_SIZE = "chunkSize";
    public static final String CHUNK_OVERLAP = "chunkOverlap";

    static final int MAX_TITLE_LENGTH = 300;
    static final int MAX_CONTENT_LENGTH = 2_000_000;

    @Override
    public Set<String> fieldNames() {
        return Set.of(SOURCE_ID, TITLE, CONTENT, CHUNK_SIZE, CHUNK_OVERLAP);
    }

    @Override
    public boolean requiresDataClass() {
        return true;
    }

    @Override
    public Map<String, Object> normalize(FieldReader reader) {
        Map<String, Object> fields = new LinkedHashMap<>();
        UUID sourceId = reader.requiredUuid(SOURCE_ID);
        String title = reader.requiredString(TITLE, MAX_TITLE_LENGTH);
        String content = reader.requiredString(CONTENT, MAX_CONTENT_LENGTH);
        Integer chunkSize = reader.optionalInt(CHUNK_SIZE, 100, 4000, 1000);
        Integer chunkOverlap = reader.optionalInt(CHUNK_OVERLAP, 0, 1000, 200);

        if (chunkSize != null && chunkOverlap != null && chunkOverlap >= chunkSize) {
            reader.addViolation(CHUNK_OVERLAP, FieldViolation.CONSTRAINT, "chunkOverlap must be smaller than chunkSize");
        }

        if (sourceId != null) {
            fields.put(SOURCE_ID, sourceId.toString());
        }
        if (title != null) {
            fields.put(TITLE, title.strip());
        }
        if (content != null) {
            fields.put(CONTENT, content);
        }
        if (chunkSize != null) {
            fields.put(CHUNK_SIZE, chunkSize);
        }
        if (chunkOverlap != null) {
            fields.put(CHUNK_OVERLAP, chunkOverlap);
        }
        return fields;
    }
}
