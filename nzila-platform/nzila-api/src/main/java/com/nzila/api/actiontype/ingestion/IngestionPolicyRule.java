package com.nzila.api.actiontype.ingestion;

import com.nzila.api.policy.ActionPolicyRule;
import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.core.domain.Action.RiskTier;

import java.util.List;

/**
 * Ingestion risk follows the data class of the ingested content.
 */
public class IngestionPolicyRule implements ActionPolicyRule {

    @Override
    public RiskTier riskTier(ValidatedProposal proposal) {
        String dataClass = proposal.dataClass();
        if (dataClass == null) {
            return RiskTier.HIGH;
        }
        return switch (dataClass) {
            case "public", "internal" -> RiskTier.LOW;
            case "confidential" -> RiskTier.MEDIUM;
            default -> RiskTier.HIGH;
        };
    }

    @Override
    public List<String> defaultApproverRoles(RiskTier tier) {
        return switch (tier) {
            case LOW -> List.of("knowledge_editor", "knowledge_admin");
            case MEDIUM -> List.of("knowledge_admin");
            case HIGH -> List.of("compliance_officer");
        };
    }
}
