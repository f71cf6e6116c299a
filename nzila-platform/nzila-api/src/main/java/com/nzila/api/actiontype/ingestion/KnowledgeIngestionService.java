package com.nzila.api.actiontype.ingestion;

import com.nzila.api.actiontype.ingestion.TextChunker.TextChunk;
import com.nzila.api.execution.ToolCall;
import com.nzila.api.storage.DocumentStorageService;
import com.nzila.core.domain.KnowledgeIngestionRun;
import com.nzila.core.domain.KnowledgeIngestionRun.IngestionStatus;
import com.nzila.core.domain.StoredDocument;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.hash.ContentHashing;
import com.nzila.core.repository.KnowledgeIngestionRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Chunks, embeds and records a knowledge source as a manifest document at
 * {@code {entityId}/knowledge/{sourceId}/{contentHash}/manifest.json}.
 *
 * Each stage is saved as it completes so a crash leaves a readable trail.
 * The same content for the same source is ingested once: a STORED run whose manifest is
 * still intact is returned as is.
 */
@Service
public class KnowledgeIngestionService {

    private static final Logger log = LoggerFactory.getLogger(KnowledgeIngestionService.class);

    private final KnowledgeIngestionRunRepository ingestionRepository;
    private final DocumentStorageService documentStorage;
    private final EmbeddingClient embeddingClient;
    private final Clock clock;

    public KnowledgeIngestionService(KnowledgeIngestionRunRepository ingestionRepository,
                                     DocumentStorageService documentStorage,
                                     EmbeddingClient embeddingClient,
                                     Clock clock) {
        this.ingestionRepository = ingestionRepository;
        this.documentStorage = documentStorage;
        this.embeddingClient = embeddingClient;
        this.clock = clock;
    }

    public IngestionOutcome ingest(IngestionRequest request) {
        String contentHash = ContentHashing.sha256(request.content());
        String path = manifestPath(request.entityId(), request.sourceId(), contentHash);
        List<ToolCall> calls = new ArrayList<>();

        long started = System.nanoTime();
        Optional<IngestionOutcome> reused = findStored(request, contentHash, path);
        calls.add(new ToolCall("knowledge.lookup",
                Map.of("sourceId", request.sourceId().toString(), "contentHash", contentHash),
                Map.of("found", reused.isPresent()), elapsedMillis(started)));
        if (reused.isPresent()) {
            log.info("Source {} with content {} already ingested for entity {}",
                    request.sourceId(), contentHash, request.entityId());
            IngestionOutcome outcome = reused.get();
            return new IngestionOutcome(outcome.run(), outcome.manifest(), true, calls);
        }

        KnowledgeIngestionRun run = ingestionRepository.save(KnowledgeIngestionRun.queue(
                request.entityId(), request.actionId(), request.sourceId(), request.title(),
                contentHash, request.content().length(), clock.instant()));
        try {
            started = System.nanoTime();
            List<TextChunk> chunks = TextChunker.chunk(request.content(), request.chunkSize(), request.chunkOverlap());
            run.markChunked(chunks.size(), clock.instant());
            run = ingestionRepository.save(run);
            calls.add(new ToolCall("knowledge.chunk",
                    Map.of("chunkSize", request.chunkSize(), "chunkOverlap", request.chunkOverlap(),
                            "characters", request.content().length()),
                    Map.of("chunkCount", chunks.size()), elapsedMillis(started)));

            started = System.nanoTime();
            List<Map<String, Object>> chunkEntries = new ArrayList<>();
            for (TextChunk chunk : chunks) {
                float[] vector = embeddingClient.embed(chunk.text());
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("index", chunk.index());
                entry.put("start", chunk.start());
                entry.put("end", chunk.end());
                entry.put("textHash", ContentHashing.sha256(chunk.text()));
                entry.put("embedding", toList(vector));
                chunkEntries.add(entry);
            }
            run.markEmbedded(chunkEntries.size(), clock.instant());
            run = ingestionRepository.save(run);
            calls.add(new ToolCall("knowledge.embed",
                    Map.of("model", embeddingClient.model(), "dimensions", embeddingClient.dimensions()),
                    Map.of("embeddingCount", chunkEntries.size()), elapsedMillis(started)));

            started = System.nanoTime();
            StoredDocument manifest = documentStorage.findIntact(path).orElse(null);
            if (manifest == null) {
                byte[] bytes = CanonicalJson.writeBytes(manifestBody(request, contentHash, chunkEntries));
                manifest = documentStorage.store(request.entityId(), StoredDocument.CATEGORY_KNOWLEDGE_MANIFEST,
                        path, bytes, "application/json", request.actionId(), request.runId());
            }
            run.markStored(manifest.getId(), path, clock.instant());
            run = ingestionRepository.save(run);
            calls.add(new ToolCall("knowledge.store", Map.of("path", path),
                    Map.of("documentId", manifest.getId().toString()), elapsedMillis(started)));

            log.info("Ingested source {} for entity {}: {} chunks", request.sourceId(), request.entityId(), chunks.size());
            return new IngestionOutcome(run, manifest, false, calls);
        } catch (RuntimeException e) {
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getName();
            log.warn("Ingestion {} of source {} failed at {}: {}", run.getId(), request.sourceId(), run.getStatus(), message);
            run.markFailed(message, clock.instant());
            ingestionRepository.save(run);
            throw new IngestionFailedException(run.getId(), message, e);
        }
    }

    private Optional<IngestionOutcome> findStored(IngestionRequest request, String contentHash, String path) {
        return ingestionRepository
                .findFirstByEntityIdAndSourceIdAndContentHashAndStatusOrderByCreatedAtAsc(
                        request.entityId(), request.sourceId(), contentHash, IngestionStatus.STORED)
                .flatMap(run -> documentStorage.findIntact(path)
                        .map(document -> new IngestionOutcome(run, document, true, List.of())));
    }

    private Map<String, Object> manifestBody(IngestionRequest request, String contentHash,
                                             List<Map<String, Object>> chunkEntries) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("entityId", request.entityId().toString());
        body.put("sourceId", request.sourceId().toString());
        body.put("title", request.title());
        body.put("contentHash", contentHash);
        body.put("characterCount", request.content().length());
        body.put("chunkSize", request.chunkSize());
        body.put("chunkOverlap", request.chunkOverlap());
        body.put("embeddingModel", embeddingClient.model());
        body.put("dimensions", embeddingClient.dimensions());
        body.put("chunks", chunkEntries);
        return body;
    }

    static String manifestPath(UUID entityId, UUID sourceId, String contentHash) {
        return entityId + "/knowledge/" + sourceId + "/" + contentHash + "/manifest.json";
    }

    private static List<Float> toList(float[] vector) {
        List<Float> values = new ArrayList<>(vector.length);
        for (float value : vector) {
            values.add(value);
        }
        return values;
    }

    private static long elapsedMillis(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }

    public record IngestionRequest(
            UUID entityId,
            UUID actionId,
            UUID runId,
            UUID sourceId,
            String title,
            String content,
            int chunkSize,
            int chunkOverlap
    ) {}

    /**
     * @param reused true when an earlier ingestion of the same content was returned
     */
    public record IngestionOutcome(KnowledgeIngestionRun run, StoredDocument manifest, boolean reused,
                                   List<ToolCall> toolCalls) {}

    public static class IngestionFailedException extends RuntimeException {
        private final UUID ingestionRunId;

        public IngestionFailedException(UUID ingestionRunId, String message, Throwable cause) {
            super("Ingestion " + ingestionRunId + " failed: " + message, cause);
            this.ingestionRunId = ingestionRunId;
        }

        public UUID getIngestionRunId() { return ingestionRunId; }
    }
}
