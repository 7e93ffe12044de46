package fr.lapetina.aiplatform.infrastructure.budget;

public record BudgetInfo(String scopeId, double total, double used, double remaining, double percentage) {

    public static BudgetInfo of(Budget budget, double used) {
        double percentage = budget.amount() > 0 ? used / budget.amount() * 100 : 100.0;
        return new BudgetInfo(budget.id(), budget.amount(), used, budget.amount() - used, percentage);
    }
}
