package com.nzila.core.domain;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Monthly spend budget of an entity for one budget category.
 * Status follows spend: WARNING from 80% of the budget, BLOCKED at 100%.
 */
@Entity
@Table(name = "ai_usage_budgets", uniqueConstraints = {
    @UniqueConstraint(name = "uq_ai_usage_budgets_month",
            columnNames = {"entity_id", "category", "budget_month"})
})
public class UsageBudget {

    static final BigDecimal WARNING_RATIO = new BigDecimal("0.80");

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @NotNull
    @Column(name = "entity_id", nullable = false)
    private UUID entityId;

    @NotNull
    @Column(nullable = false, length = 60)
    private String category;

    @NotNull
    @Column(name = "budget_month", nullable = false, length = 7)
    private String month;

    @NotNull
    @Column(name = "budget_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal budgetAmount;

    @NotNull
    @Column(name = "spent_amount", nullable = false, precision = 19, scale = 4)
    private BigDecimal spentAmount;

    @NotNull
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private BudgetStatus status;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Version
    private Long version;

    protected UsageBudget() {}

    public static UsageBudget create(UUID entityId, String category, String month, BigDecimal budgetAmount, Instant now) {
        if (budgetAmount == null || budgetAmount.signum() < 0) {
            throw new IllegalArgumentException("Budget amount must be non-negative");
        }
        var budget = new UsageBudget();
        budget.entityId = entityId;
        budget.category = category;
        budget.month = month;
        budget.budgetAmount = budgetAmount;
        budget.spentAmount = BigDecimal.ZERO;
        budget.updatedAt = now;
        budget.status = budget.computeStatus();
        return budget;
    }

    public void recordSpend(BigDecimal amount, Instant now) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        this.spentAmount = spentAmount.add(amount);
        this.status = computeStatus();
        this.updatedAt = now;
    }

    public boolean isBlocked() {
        return status == BudgetStatus.BLOCKED;
    }

    public BigDecimal remaining() {
        return budgetAmount.subtract(spentAmount).max(BigDecimal.ZERO);
    }

    private BudgetStatus computeStatus() {
        if (budgetAmount.signum() == 0 || spentAmount.compareTo(budgetAmount) >= 0) {
            return BudgetStatus.BLOCKED;
        }
        BigDecimal warningLine = budgetAmount.multiply(WARNING_RATIO);
        return spentAmount.compareTo(warningLine) >= 0 ? BudgetStatus.WARNING : BudgetStatus.OK;
    }

    // Getters
    public UUID getId() { return id; }
    public UUID getEntityId() { return entityId; }
    public String getCategory() { return category; }
    public String getMonth() { return month; }
    public BigDecimal getBudgetAmount() { return budgetAmount; }
    public BigDecimal getSpentAmount() { return spentAmount; }
    public BudgetStatus getStatus() { return status; }
    public Instant getUpdatedAt() { return updatedAt; }

    public enum BudgetStatus {
        OK,
        WARNING,
        BLOCKED
    }
}
