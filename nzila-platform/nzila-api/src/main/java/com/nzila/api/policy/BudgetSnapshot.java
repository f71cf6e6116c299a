package com.nzila.api.policy;

import com.nzila.core.domain.UsageBudget;
import com.nzila.core.domain.UsageBudget.BudgetStatus;

import java.math.BigDecimal;

public record BudgetSnapshot(
        String category,
        String month,
        BudgetStatus status,
        BigDecimal budgetAmount,
        BigDecimal spentAmount
) {

    public static BudgetSnapshot of(UsageBudget budget) {
        return new BudgetSnapshot(
                budget.getCategory(),
                budget.getMonth(),
                budget.getStatus(),
                budget.getBudgetAmount(),
                budget.getSpentAmount());
    }
}
