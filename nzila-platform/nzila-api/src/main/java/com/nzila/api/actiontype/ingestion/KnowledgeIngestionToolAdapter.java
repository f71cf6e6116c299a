package com.nzila.api.actiontype.ingestion;

import com.nzila.api.actiontype.ingestion.KnowledgeIngestionService.IngestionFailedException;
import com.nzila.api.actiontype.ingestion.KnowledgeIngestionService.IngestionOutcome;
import com.nzila.api.actiontype.ingestion.KnowledgeIngestionService.IngestionRequest;
import com.nzila.api.execution.ArtifactRef;
import com.nzila.api.execution.ToolAdapter;
import com.nzila.api.execution.ToolExecutionException;
import com.nzila.api.execution.ToolInvocation;
import com.nzila.api.execution.ToolResult;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

@Component
public class KnowledgeIngestionToolAdapter implements ToolAdapter {

    private final KnowledgeIngestionService ingestionService;
    private final BigDecimal costPerChunk;

    public KnowledgeIngestionToolAdapter(KnowledgeIngestionService ingestionService,
                                         @Value("${nzila.tools.ingestion.cost-per-chunk:0.001}") BigDecimal costPerChunk) {
        this.ingestionService = ingestionService;
        this.costPerChunk = costPerChunk;
    }

    @Override
    public ToolResult invoke(ToolInvocation invocation) {
        IngestionRequest request = new IngestionRequest(
                invocation.entityId(),
                invocation.actionId(),
                invocation.runId(),
                UUID.fromString(invocation.string(IngestionProposalSchema.SOURCE_ID)),
                invocation.string(IngestionProposalSchema.TITLE),
                invocation.string(IngestionProposalSchema.CONTENT),
                invocation.integer(IngestionProposalSchema.CHUNK_SIZE),
                invocation.integer(IngestionProposalSchema.CHUNK_OVERLAP));

        IngestionOutcome outcome;
        try {
            outcome = ingestionService.ingest(request);
        } catch (IngestionFailedException e) {
            throw new ToolExecutionException(e.getMessage(), e);
        }

        BigDecimal cost = outcome.reused()
                ? BigDecimal.ZERO
                : costPerChunk.multiply(BigDecimal.valueOf(outcome.run().getChunkCount()));
        return new ToolResult(List.of(ArtifactRef.of(outcome.manifest())), outcome.toolCalls(), cost);
    }
}
