package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.Instant;

public record BudgetAlert(
        String budgetId,
        String budgetName,
        Level level,
        AlertAction action,
        double threshold,
        double spent,
        double amount,
        double percentage,
        Instant timestamp
) {

    public enum Level {
        WARNING,
        CRITICAL
    }
}
