package fr.lapetina.aiplatform.infrastructure.budget;

import java.util.Map;

/**
 * Outcome of an admission check.
 *
 * @param budgets per-scope state for the scopes evaluated, keyed by scope id
 */
public record BudgetCheckResult(boolean allowed, String reason, ScopeType rejectedScope, Map<String, BudgetInfo> budgets) {

    public BudgetCheckResult {
        budgets = budgets == null ? Map.of() : Map.copyOf(budgets);
    }

    static BudgetCheckResult allowed(Map<String, BudgetInfo> budgets) {
        return new BudgetCheckResult(true, "", null, budgets);
    }

    static BudgetCheckResult rejected(ScopeType scope, String reason, Map<String, BudgetInfo> budgets) {
        return new BudgetCheckResult(false, reason, scope, budgets);
    }
}
