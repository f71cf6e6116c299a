package com.nzila.api.actiontype.report;

import com.nzila.core.domain.Action;
import com.nzila.core.domain.UsageBudget;
import com.nzila.core.repository.ActionRepository;
import com.nzila.core.repository.UsageBudgetRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Builds report rows from the engine's own records: usage budgets for billing and
 * remittance, action counts for usage.
 */
@Component
public class EngineLedgerReportSource implements ReportDataSource {

    private final ActionRepository actionRepository;
    private final UsageBudgetRepository budgetRepository;

    public EngineLedgerReportSource(ActionRepository actionRepository, UsageBudgetRepository budgetRepository) {
        this.actionRepository = actionRepository;
        this.budgetRepository = budgetRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ReportLine> lines(UUID entityId, String period, String reportKind) {
        return switch (reportKind) {
            case "billing_summary" -> budgetLines(entityId, period, false);
            case "dues_remittance" -> budgetLines(entityId, period, true);
            case "usage_summary" -> usageLines(entityId, period);
            default -> throw new IllegalArgumentException("Unsupported report kind: " + reportKind);
        };
    }

    private List<ReportLine> budgetLines(UUID entityId, String period, boolean remaining) {
        List<ReportLine> lines = new ArrayList<>();
        for (UsageBudget budget : budgetRepository.findByEntityIdAndMonthOrderByCategoryAsc(entityId, period)) {
            BigDecimal amount = remaining ? budget.remaining() : budget.getSpentAmount();
            lines.add(new ReportLine(budget.getCategory(), 1, amount));
        }
        return lines;
    }

    private List<ReportLine> usageLines(UUID entityId, String period) {
        Map<String, Long> counts = new TreeMap<>();
        for (Action action : actionRepository.findByEntityIdAndPeriodLabelOrderByProposedAtAsc(entityId, period)) {
            counts.merge(action.getActionType() + ":" + action.getStatus().name().toLowerCase(Locale.ROOT), 1L, Long::sum);
        }
        List<ReportLine> lines = new ArrayList<>();
        counts.forEach((label, count) -> lines.add(new ReportLine(label, count, BigDecimal.ZERO)));
        return lines;
    }
}
