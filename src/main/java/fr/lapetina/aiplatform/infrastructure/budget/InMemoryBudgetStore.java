package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

public final class InMemoryBudgetStore implements BudgetStore {

    private final Map<String, Budget> budgets = new ConcurrentHashMap<>();
    private final List<CostRecord> costRecords = new CopyOnWriteArrayList<>();
    private final Map<String, Double> dailyCosts = new ConcurrentHashMap<>();

    @Override
    public void saveBudget(Budget budget) {
        budgets.put(budget.id(), budget);
    }

    @Override
    public List<Budget> loadBudgets() {
        return new ArrayList<>(budgets.values());
    }

    @Override
    public void saveCostRecord(CostRecord record) {
        costRecords.add(record);
    }

    @Override
    public void addDailyCost(LocalDate date, String scopeId, double delta) {
        dailyCosts.merge(date + "|" + scopeId, delta, Double::sum);
    }

    public double getDailyCost(LocalDate date, String scopeId) {
        return dailyCosts.getOrDefault(date + "|" + scopeId, 0.0);
    }

    public List<CostRecord> getCostRecords() {
        return List.copyOf(costRecords);
    }
}
