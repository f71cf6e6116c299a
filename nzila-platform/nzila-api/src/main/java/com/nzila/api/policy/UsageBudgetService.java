package com.nzila.api.policy;

import com.nzila.core.domain.UsageBudget;
import com.nzila.core.domain.UsageBudget.BudgetStatus;
import com.nzila.core.repository.UsageBudgetRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Optional;
import java.util.UUID;

/**
 * JPA-backed budget service over {@code ai_usage_budgets}.
 */
@Service
public class UsageBudgetService implements BudgetService {

    private static final Logger log = LoggerFactory.getLogger(UsageBudgetService.class);

    private final UsageBudgetRepository repository;
    private final Clock clock;

    public UsageBudgetService(UsageBudgetRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<BudgetSnapshot> snapshot(UUID entityId, String category, String month) {
        return repository.findByEntityIdAndCategoryAndMonth(entityId, category, month).map(BudgetSnapshot::of);
    }

    @Override
    @Transactional
    public void recordSpend(UUID entityId, String category, String month, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            return;
        }
        Optional<UsageBudget> budget = repository.findForUpdate(entityId, category, month);
        if (budget.isEmpty()) {
            log.debug("No {} budget for entity {} in {}, spend of {} not tracked", category, entityId, month, amount);
            return;
        }
        UsageBudget current = budget.get();
        BudgetStatus before = current.getStatus();
        current.recordSpend(amount, clock.instant());
        if (current.getStatus() != before) {
            log.warn("Budget {} for entity {} in {} moved from {} to {}",
                    category, entityId, month, before, current.getStatus());
        }
    }

    /**
     * Creates the budget for a month unless one already exists.
     */
    @Transactional
    public UsageBudget allocate(UUID entityId, String category, String month, BigDecimal amount) {
        return repository.findByEntityIdAndCategoryAndMonth(entityId, category, month)
                .orElseGet(() -> repository.save(UsageBudget.create(entityId, category, month, amount, clock.instant())));
    }
}
