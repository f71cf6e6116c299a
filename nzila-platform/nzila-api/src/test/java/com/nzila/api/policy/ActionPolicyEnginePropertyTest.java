package com.nzila.api.policy;

import com.nzila.api.actiontype.ingestion.IngestionPolicyRule;
import com.nzila.api.actiontype.report.ReportPolicyRule;
import com.nzila.api.policy.PolicyDecision.Outcome;
import com.nzila.api.proposal.ProposalValidator;
import com.nzila.api.proposal.ValidatedProposal;
import com.nzila.api.support.Proposals;
import com.nzila.core.domain.Action.RiskTier;
import com.nzila.core.domain.CapabilityProfile;
import com.nzila.core.domain.UsageBudget.BudgetStatus;
import net.jqwik.api.*;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

import static com.nzila.api.config.ActionTypesConfig.FINANCE_GENERATE_REPORT;
import static com.nzila.api.config.ActionTypesConfig.KNOWLEDGE_INGEST;
import static org.assertj.core.api.Assertions.*;

/**
 * Fail-closed policy evaluation: ordered checks, first failure wins, identical input gives identical output.
 */
class ActionPolicyEnginePropertyTest {

    private final ActionPolicyEngine engine = new ActionPolicyEngine("test-1");
    private final ProposalValidator validator = new ProposalValidator(Proposals.registry());

    @Example
    void missingProfileDeniesAtFirstCheck() {
        PolicyDecision decision = engine.evaluate(
                new PolicyInput(report(UUID.randomUUID()), null, null, false), new ReportPolicyRule());

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.failedCheck()).isEqualTo(PolicyCheck.PROFILE_ENABLED);
        assertThat(decision.reasonCode()).isEqualTo("PROFILE_NOT_FOUND");
        assertThat(decision.riskTier()).isNull();
        assertThat(decision.checks()).hasSize(1);
    }

    @Example
    void lowRiskReportIsAutoApprovedWhenListed() {
        PolicyDecision decision = engine.evaluate(
                new PolicyInput(report(UUID.randomUUID()), profile(true, List.of(FINANCE_GENERATE_REPORT)), null, false),
                new ReportPolicyRule());

        assertThat(decision.outcome()).isEqualTo(Outcome.ALLOW_AUTO);
        assertThat(decision.riskTier()).isEqualTo(RiskTier.LOW);
        assertThat(decision.requiredApproverRoles()).isEmpty();
        assertThat(decision.checks()).extracting(PolicyCheck::name).containsExactly(
                PolicyCheck.PROFILE_ENABLED, PolicyCheck.FEATURE_FLAG, PolicyCheck.ACTION_TYPE_ALLOWED,
                PolicyCheck.DATA_CLASS_PERMITTED, PolicyCheck.BUDGET_AVAILABLE, PolicyCheck.RISK_TIER);
    }

    @Example
    void lowRiskReportNeedsApprovalWhenNotListed() {
        PolicyDecision decision = engine.evaluate(
                new PolicyInput(report(UUID.randomUUID()), profile(true, List.of()), null, false),
                new ReportPolicyRule());

        assertThat(decision.outcome()).isEqualTo(Outcome.REQUIRE_APPROVAL);
        assertThat(decision.requiredApproverRoles()).containsExactly("finance_admin", "finance_manager");
    }

    @Example
    void regulatedIngestionIsDeniedAtDataClassCheck() {
        ValidatedProposal proposal = validator.validate(KNOWLEDGE_INGEST,
                Proposals.ingestion(UUID.randomUUID(), "regulated", "Board minutes"));

        PolicyDecision decision = engine.evaluate(
                new PolicyInput(proposal, profile(true, List.of()), null, false), new IngestionPolicyRule());

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.failedCheck()).isEqualTo(PolicyCheck.DATA_CLASS_PERMITTED);
        assertThat(decision.reasonCode()).isEqualTo("DATA_CLASS_NOT_PERMITTED");
    }

    @Example
    void blockedBudgetDenies() {
        BudgetSnapshot blocked = new BudgetSnapshot("reports", "2026-01", BudgetStatus.BLOCKED,
                new BigDecimal("10"), new BigDecimal("10"));

        PolicyDecision decision = engine.evaluate(
                new PolicyInput(report(UUID.randomUUID()), profile(true, List.of(FINANCE_GENERATE_REPORT)), blocked, false),
                new ReportPolicyRule());

        assertThat(decision.failedCheck()).isEqualTo(PolicyCheck.BUDGET_AVAILABLE);
        assertThat(decision.reasonCode()).isEqualTo("BUDGET_BLOCKED");
    }

    @Example
    void missingBudgetDeniesOnlyWhenRequired() {
        CapabilityProfileSnapshot profile = profile(true, List.of(FINANCE_GENERATE_REPORT));
        ValidatedProposal proposal = report(UUID.randomUUID());

        assertThat(engine.evaluate(new PolicyInput(proposal, profile, null, true), new ReportPolicyRule()).reasonCode())
                .isEqualTo("BUDGET_MISSING");
        assertThat(engine.evaluate(new PolicyInput(proposal, profile, null, false), new ReportPolicyRule()).outcome())
                .isEqualTo(Outcome.ALLOW_AUTO);
    }

    @Example
    void ruleFailureBecomesEvaluationErrorDeny() {
        ActionPolicyRule broken = new ActionPolicyRule() {
            @Override
            public RiskTier riskTier(ValidatedProposal proposal) {
                throw new IllegalStateException("rule exploded");
            }

            @Override
            public List<String> defaultApproverRoles(RiskTier tier) {
                return List.of();
            }
        };

        PolicyDecision decision = engine.evaluate(
                new PolicyInput(report(UUID.randomUUID()), profile(true, List.of()), null, false), broken);

        assertThat(decision.outcome()).isEqualTo(Outcome.DENY);
        assertThat(decision.reasonCode()).isEqualTo(PolicyDecision.EVALUATION_ERROR);
    }

    @Example
    void profileApproverRolesResolveIndependentOfDefaultLocale() {
        Map<String, Object> payload = Proposals.report(UUID.randomUUID(), "2026-01");
        payload.put("dataClass", "sensitive");
        ValidatedProposal proposal = validator.validate(FINANCE_GENERATE_REPORT, payload);
        CapabilityProfileSnapshot profile = new CapabilityProfileSnapshot(
                UUID.randomUUID(),
                Proposals.APP,
                Proposals.PROFILE,
                true,
                List.of(CapabilityProfile.FEATURE_ACTIONS_PROPOSE),
                List.of("public", "internal", "confidential", "sensitive"),
                List.of(FINANCE_GENERATE_REPORT),
                List.of(),
                Map.of("medium", List.of("controller")));
        PolicyInput input = new PolicyInput(proposal, profile, null, false);

        Locale original = Locale.getDefault();
        PolicyDecision turkish;
        try {
            Locale.setDefault(new Locale("tr", "TR"));
            turkish = engine.evaluate(input, new ReportPolicyRule());
        } finally {
            Locale.setDefault(original);
        }
        PolicyDecision root = engine.evaluate(input, new ReportPolicyRule());

        assertThat(turkish.riskTier()).isEqualTo(RiskTier.MEDIUM);
        assertThat(turkish.requiredApproverRoles()).containsExactly("controller");
        assertThat(turkish.toCanonicalJson()).isEqualTo(root.toCanonicalJson());
    }

    @Property(tries = 100)
    @Label("Same input yields byte-identical decisions")
    void evaluationIsDeterministic(@ForAll boolean enabled,
                                   @ForAll boolean autoApprove,
                                   @ForAll("budgetStatuses") BudgetStatus status,
                                   @ForAll long seed) {
        ValidatedProposal proposal = report(new UUID(seed, seed ^ 0x5f5f));
        CapabilityProfileSnapshot profile = profile(enabled, autoApprove ? List.of(FINANCE_GENERATE_REPORT) : List.of());
        BudgetSnapshot budget = new BudgetSnapshot("reports", "2026-01", status, BigDecimal.TEN, BigDecimal.ONE);
        PolicyInput input = new PolicyInput(proposal, profile, budget, false);

        PolicyDecision first = engine.evaluate(input, new ReportPolicyRule());
        PolicyDecision second = engine.evaluate(input, new ReportPolicyRule());

        assertThat(second.toCanonicalJson()).isEqualTo(first.toCanonicalJson());
        assertThat(second.hash()).isEqualTo(first.hash());
        if (first.isDenied()) {
            assertThat(first.failedCheck()).isNotNull();
            assertThat(first.checks()).filteredOn(check -> !check.passed()).hasSize(1);
            assertThat(first.checks().get(first.checks().size() - 1).passed()).isFalse();
        }
    }

    @Provide
    Arbitrary<BudgetStatus> budgetStatuses() {
        return Arbitraries.of(BudgetStatus.class);
    }

    private ValidatedProposal report(UUID entityId) {
        return validator.validate(FINANCE_GENERATE_REPORT, Proposals.report(entityId, "2026-01"));
    }

    private static CapabilityProfileSnapshot profile(boolean enabled, List<String> autoApprove) {
        return new CapabilityProfileSnapshot(
                UUID.randomUUID(),
                Proposals.APP,
                Proposals.PROFILE,
                enabled,
                List.of(CapabilityProfile.FEATURE_ACTIONS_PROPOSE),
                List.of("public", "internal", "confidential"),
                List.of(FINANCE_GENERATE_REPORT, KNOWLEDGE_INGEST),
                autoApprove,
                Map.of());
    }
}
