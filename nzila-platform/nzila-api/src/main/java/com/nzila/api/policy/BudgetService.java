package com.nzila.api.policy;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.UUID;

/**
 * Monthly usage budgets per entity and category.
 */
public interface BudgetService {

    Optional<BudgetSnapshot> snapshot(UUID entityId, String category, String month);

    /**
     * Adds spend to an existing budget. Does nothing when the entity has no budget for the month.
     */
    void recordSpend(UUID entityId, String category, String month, BigDecimal amount);
}
