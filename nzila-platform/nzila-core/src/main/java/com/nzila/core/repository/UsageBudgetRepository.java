package com.nzila.core.repository;

import com.nzila.core.domain.UsageBudget;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UsageBudgetRepository extends JpaRepository<UsageBudget, UUID> {

    Optional<UsageBudget> findByEntityIdAndCategoryAndMonth(UUID entityId, String category, String month);

    List<UsageBudget> findByEntityIdAndMonthOrderByCategoryAsc(UUID entityId, String month);

    /**
     * Locks the budget row while spend is recorded.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM UsageBudget b WHERE b.entityId = :entityId AND b.category = :category AND b.month = :month")
    Optional<UsageBudget> findForUpdate(@Param("entityId") UUID entityId,
                                        @Param("category") String category,
                                        @Param("month") String month);
}
