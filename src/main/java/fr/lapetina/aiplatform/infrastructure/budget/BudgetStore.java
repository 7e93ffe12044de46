package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.LocalDate;
import java.util.List;

/**
 * Durable storage for budgets, cost records and daily cost statistics.
 */
public interface BudgetStore {

    void saveBudget(Budget budget);

    List<Budget> loadBudgets();

    void saveCostRecord(CostRecord record);

    /**
     * Adds {@code delta} to the daily total of a scope. Repeated calls accumulate.
     */
    void addDailyCost(LocalDate date, String scopeId, double delta);
}
