package com.nzila.api.actiontype.ingestion;

import com.nzila.api.action.ActionEngine;
import com.nzila.api.evidence.EvidenceAppendix;
import com.nzila.api.policy.UsageBudgetService;
import com.nzila.api.storage.DocumentBlobStore;
import com.nzila.api.storage.DocumentStorageService;
import com.nzila.api.support.EngineFixtures;
import com.nzila.api.support.Proposals;
import com.nzila.api.support.TestActionTypes;
import com.nzila.core.domain.ActionRun;
import com.nzila.core.domain.ActionRun.RunStatus;
import com.nzila.core.domain.KnowledgeIngestionRun;
import com.nzila.core.domain.KnowledgeIngestionRun.IngestionStatus;
import com.nzila.core.hash.CanonicalJson;
import com.nzila.core.hash.ContentHashing;
import com.nzila.core.repository.KnowledgeIngestionRunRepository;
import com.nzila.core.repository.UsageBudgetRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static com.nzila.api.config.ActionTypesConfig.KNOWLEDGE_INGEST;
import static org.assertj.core.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
@Import(TestActionTypes.class)
class KnowledgeIngestionIntegrationTest {

    private static final String HANDBOOK = "Section 1. Dues are remitted by the fifteenth of each month. ".repeat(60);

    @Autowired private ActionEngine engine;
    @Autowired private UsageBudgetService budgetService;
    @Autowired private KnowledgeIngestionRunRepository ingestionRepository;
    @Autowired private UsageBudgetRepository budgetRepository;
    @Autowired private DocumentStorageService documentStorage;
    @Autowired private DocumentBlobStore blobStore;
    @Autowired private EngineFixtures fixtures;

    @Test
    void internalSourceIsChunkedEmbeddedAndStored() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(KNOWLEDGE_INGEST));
        budgetService.allocate(entityId, "knowledge", fixtures.currentMonth(), new BigDecimal("5"));
        Map<String, Object> payload = Proposals.ingestion(entityId, "internal", HANDBOOK);

        ActionRun run = engine.proposeAndExecute(KNOWLEDGE_INGEST, payload);

        assertThat(run.getStatus()).isEqualTo(RunStatus.SUCCESS);
        List<KnowledgeIngestionRun> ingestions = ingestionRepository.findByActionIdIn(List.of(run.getActionId()));
        assertThat(ingestions).singleElement().satisfies(ingestion -> {
            assertThat(ingestion.getStatus()).isEqualTo(IngestionStatus.STORED);
            assertThat(ingestion.getChunkCount()).isGreaterThan(1);
            assertThat(ingestion.getEmbeddingCount()).isEqualTo(ingestion.getChunkCount());
            assertThat(ingestion.getContentHash()).isEqualTo(ContentHashing.sha256(HANDBOOK));
            assertThat(ingestion.getManifestPath()).isEqualTo(KnowledgeIngestionService.manifestPath(
                    entityId, UUID.fromString((String) payload.get("sourceId")), ingestion.getContentHash()));
        });

        KnowledgeIngestionRun ingestion = ingestions.get(0);
        Map<String, Object> manifest = CanonicalJson.readMap(documentStorage.read(ingestion.getManifestPath()).orElseThrow());
        assertThat(manifest).containsEntry("contentHash", ingestion.getContentHash());
        assertThat((List<?>) manifest.get("chunks")).hasSize(ingestion.getChunkCount());

        BigDecimal expectedCost = new BigDecimal("0.001").multiply(BigDecimal.valueOf(ingestion.getChunkCount()));
        assertThat(budgetRepository.findByEntityIdAndCategoryAndMonth(entityId, "knowledge", fixtures.currentMonth()))
                .hasValueSatisfying(budget -> assertThat(budget.getSpentAmount()).isEqualByComparingTo(expectedCost));
    }

    @Test
    void sameContentForSameSourceIsIngestedOnce() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(KNOWLEDGE_INGEST));
        Map<String, Object> payload = Proposals.ingestion(entityId, "public", HANDBOOK);

        ActionRun first = engine.proposeAndExecute(KNOWLEDGE_INGEST, payload);
        ActionRun second = engine.proposeAndExecute(KNOWLEDGE_INGEST, payload);

        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(CanonicalJson.readList(second.getArtifactsJson()))
                .isEqualTo(CanonicalJson.readList(first.getArtifactsJson()));
        assertThat(ingestionRepository.findByActionIdIn(List.of(first.getActionId(), second.getActionId())))
                .singleElement()
                .satisfies(ingestion -> assertThat(ingestion.getActionId()).isEqualTo(first.getActionId()));

        EvidenceAppendix evidence = engine.collectEvidence(entityId, engine.getAction(first.getActionId()).getPeriodLabel());
        assertThat(evidence.summary().totalActions()).isEqualTo(2);
        assertThat(evidence.summary().attestationCount()).isEqualTo(2);
    }

    @Test
    void damagedManifestIsRewrittenWhenSourceIsIngestedAgain() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(KNOWLEDGE_INGEST));
        Map<String, Object> payload = Proposals.ingestion(entityId, "public", HANDBOOK);

        ActionRun first = engine.proposeAndExecute(KNOWLEDGE_INGEST, payload);
        String path = ingestionRepository.findByActionIdIn(List.of(first.getActionId())).get(0).getManifestPath();
        blobStore.put(path, "truncated".getBytes(StandardCharsets.UTF_8));

        ActionRun second = engine.proposeAndExecute(KNOWLEDGE_INGEST, payload);

        assertThat(second.getStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(ingestionRepository.findByActionIdIn(List.of(second.getActionId())))
                .singleElement()
                .satisfies(ingestion -> assertThat(ingestion.getStatus()).isEqualTo(IngestionStatus.STORED));
        assertThat(documentStorage.findIntact(path)).isPresent();
        Map<String, Object> manifest = CanonicalJson.readMap(documentStorage.read(path).orElseThrow());
        assertThat(manifest).containsEntry("contentHash", ContentHashing.sha256(HANDBOOK));
    }

    @Test
    void confidentialSourceWaitsForApproval() {
        UUID entityId = UUID.randomUUID();
        fixtures.profile(entityId, List.of(KNOWLEDGE_INGEST));

        var action = engine.proposeAction(KNOWLEDGE_INGEST, Proposals.ingestion(entityId, "confidential", HANDBOOK));

        assertThat(action.getStatus()).isEqualTo(com.nzila.core.domain.Action.ActionStatus.AWAITING_APPROVAL);
        assertThat(CanonicalJson.readList(action.getRequiredApproverRoles())).containsExactly("knowledge_admin");
    }
}
