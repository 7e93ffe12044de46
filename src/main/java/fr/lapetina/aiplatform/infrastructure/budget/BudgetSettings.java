package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.Duration;
import java.util.List;

/**
 * @param defaultBudgets budgets seeded at startup when the store holds none
 */
public record BudgetSettings(Duration reconcileInterval, List<Budget> defaultBudgets) {

    public BudgetSettings {
        if (reconcileInterval == null || reconcileInterval.isZero() || reconcileInterval.isNegative()) {
            throw new IllegalArgumentException("Reconcile interval must be positive");
        }
        defaultBudgets = defaultBudgets == null ? List.of() : List.copyOf(defaultBudgets);
    }

    /**
     * Global monthly ceiling of 30000 and a daily ceiling of 1000 for text-to-image.
     */
    public static BudgetSettings defaults() {
        Budget global = new Budget("global", "Global budget", ScopeType.GLOBAL, null, 30000,
                BudgetPeriod.MONTHLY, null,
                List.of(AlertThreshold.of(0.7, AlertAction.NOTIFY),
                        AlertThreshold.of(0.9, AlertAction.SWITCH_TO_THIRD_PARTY)),
                null, null);
        Budget textToImage = new Budget(null, "Text-to-image budget", ScopeType.SERVICE, "text_to_image", 1000,
                BudgetPeriod.DAILY, null,
                List.of(AlertThreshold.of(0.7, AlertAction.NOTIFY),
                        AlertThreshold.of(0.9, AlertAction.BLOCK)),
                null, null);
        return new BudgetSettings(Duration.ofSeconds(60), List.of(global, textToImage));
    }
}
