package com.nzila.api.support;

import com.nzila.api.actiontype.ingestion.IngestionPolicyRule;
import com.nzila.api.actiontype.ingestion.IngestionProposalSchema;
import com.nzila.api.actiontype.report.ReportPolicyRule;
import com.nzila.api.actiontype.report.ReportProposalSchema;
import com.nzila.api.config.ActionTypesConfig;
import com.nzila.api.execution.ToolAdapter;
import com.nzila.api.execution.ToolResult;
import com.nzila.api.registry.ActionTypeDefinition;
import com.nzila.api.registry.ActionTypeRegistry;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Payload builders shared by the tests.
 */
public final class Proposals {

    public static final String APP = "finance-portal";
    public static final String PROFILE = "assistant";

    private Proposals() {
    }

    public static Map<String, Object> report(UUID entityId, String period) {
        Map<String, Object> payload = envelope(entityId);
        payload.put(ReportProposalSchema.PERIOD, period);
        payload.put(ReportProposalSchema.REPORT_KIND, "billing_summary");
        return payload;
    }

    public static Map<String, Object> ingestion(UUID entityId, String dataClass, String content) {
        Map<String, Object> payload = envelope(entityId);
        payload.put("dataClass", dataClass);
        payload.put(IngestionProposalSchema.SOURCE_ID, UUID.randomUUID().toString());
        payload.put(IngestionProposalSchema.TITLE, "Member handbook");
        payload.put(IngestionProposalSchema.CONTENT, content);
        return payload;
    }

    public static Map<String, Object> envelope(UUID entityId) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("entityId", entityId.toString());
        payload.put("appKey", APP);
        payload.put("profileKey", PROFILE);
        payload.put("requestedBy", "assistant-7");
        return payload;
    }

    /**
     * Registry with the built-in schemas and rules, backed by adapters that do nothing.
     */
    public static ActionTypeRegistry registry() {
        ToolAdapter noop = invocation -> new ToolResult(List.of(), List.of(), null);
        return new ActionTypeRegistry(List.of(
                new ActionTypeDefinition(ActionTypesConfig.FINANCE_GENERATE_REPORT, new ReportProposalSchema(),
                        new ReportPolicyRule(), noop, "reports"),
                new ActionTypeDefinition(ActionTypesConfig.KNOWLEDGE_INGEST, new IngestionProposalSchema(),
                        new IngestionPolicyRule(), noop, "knowledge")));
    }
}
