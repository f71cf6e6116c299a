package com.nzila.api.config;

import com.nzila.api.actiontype.ingestion.IngestionPolicyRule;
import com.nzila.api.actiontype.ingestion.IngestionProposalSchema;
import com.nzila.api.actiontype.ingestion.KnowledgeIngestionToolAdapter;
import com.nzila.api.actiontype.report.ReportGenerationToolAdapter;
import com.nzila.api.actiontype.report.ReportPolicyRule;
import com.nzila.api.actiontype.report.ReportProposalSchema;
import com.nzila.api.registry.ActionTypeDefinition;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Built-in action types. Each definition bean is picked up by the action type registry.
 */
@Configuration
public class ActionTypesConfig {

    public static final String FINANCE_GENERATE_REPORT = "finance.generate_report";
    public static final String KNOWLEDGE_INGEST = "knowledge.ingest";

    @Bean
    public ActionTypeDefinition financeGenerateReport(ReportGenerationToolAdapter adapter) {
        return new ActionTypeDefinition(FINANCE_GENERATE_REPORT, new ReportProposalSchema(),
                new ReportPolicyRule(), adapter, "reports");
    }

    @Bean
    public ActionTypeDefinition knowledgeIngest(KnowledgeIngestionToolAdapter adapter) {
        return new ActionTypeDefinition(KNOWLEDGE_INGEST, new IngestionProposalSchema(),
                new IngestionPolicyRule(), adapter, "knowledge");
    }
}
