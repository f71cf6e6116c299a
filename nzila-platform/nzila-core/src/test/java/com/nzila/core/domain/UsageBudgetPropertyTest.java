package com.nzila.core.domain;

import com.nzila.core.domain.UsageBudget.BudgetStatus;
import net.jqwik.api.*;
import net.jqwik.api.constraints.BigRange;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Property-based tests for usage budget thresholds.
 */
class UsageBudgetPropertyTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Property(tries = 200)
    @Label("Status follows the 80% warning and 100% blocking thresholds")
    void statusFollowsThresholds(
            @ForAll @BigRange(min = "1", max = "10000") BigDecimal budgetAmount,
            @ForAll @BigRange(min = "0.01", max = "20000") BigDecimal spend) {

        UsageBudget budget = UsageBudget.create(UUID.randomUUID(), "reports", "2026-01", budgetAmount, NOW);
        budget.recordSpend(spend, NOW);

        BigDecimal warningLine = budgetAmount.multiply(new BigDecimal("0.80"));
        if (spend.compareTo(budgetAmount) >= 0) {
            assertThat(budget.getStatus()).isEqualTo(BudgetStatus.BLOCKED);
            assertThat(budget.remaining()).isEqualByComparingTo(BigDecimal.ZERO);
        } else if (spend.compareTo(warningLine) >= 0) {
            assertThat(budget.getStatus()).isEqualTo(BudgetStatus.WARNING);
        } else {
            assertThat(budget.getStatus()).isEqualTo(BudgetStatus.OK);
        }
    }

    @Example
    void zeroBudgetIsBlocked() {
        UsageBudget budget = UsageBudget.create(UUID.randomUUID(), "reports", "2026-01", BigDecimal.ZERO, NOW);
        assertThat(budget.isBlocked()).isTrue();
    }

    @Example
    void warningStartsAtEightyPercent() {
        UsageBudget budget = UsageBudget.create(UUID.randomUUID(), "reports", "2026-01", new BigDecimal("100"), NOW);
        budget.recordSpend(new BigDecimal("79.99"), NOW);
        assertThat(budget.getStatus()).isEqualTo(BudgetStatus.OK);
        budget.recordSpend(new BigDecimal("0.01"), NOW);
        assertThat(budget.getStatus()).isEqualTo(BudgetStatus.WARNING);
        budget.recordSpend(new BigDecimal("20"), NOW);
        assertThat(budget.getStatus()).isEqualTo(BudgetStatus.BLOCKED);
    }

    @Example
    void nonPositiveSpendIsIgnored() {
        UsageBudget budget = UsageBudget.create(UUID.randomUUID(), "reports", "2026-01", new BigDecimal("10"), NOW);
        budget.recordSpend(new BigDecimal("-5"), NOW);
        assertThat(budget.getSpentAmount()).isEqualByComparingTo(BigDecimal.ZERO);
    }
}
