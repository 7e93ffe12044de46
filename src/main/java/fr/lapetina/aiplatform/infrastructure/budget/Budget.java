package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.Instant;
import java.util.List;

/**
 * Spend ceiling for one scope. Replaced as a whole on update.
 *
 * @param id       scope id, e.g. {@code global} or {@code service:text_to_image}
 * @param targetId feature or tenant id, null for the global scope
 */
public record Budget(
        String id,
        String name,
        ScopeType scopeType,
        String targetId,
        double amount,
        BudgetPeriod period,
        Instant periodStart,
        List<AlertThreshold> alerts,
        Instant createdAt,
        Instant updatedAt
) {

    public Budget {
        if (scopeType == null) {
            throw new IllegalArgumentException("Budget scope type is required");
        }
        if (amount < 0) {
            throw new IllegalArgumentException("Budget amount must be >= 0: " + amount);
        }
        String scopeId = scopeType.scopeId(targetId);
        if (id == null || id.isBlank()) {
            id = scopeId;
        } else if (!id.equals(scopeId)) {
            throw new IllegalArgumentException("Budget id must be its scope id " + scopeId + ": " + id);
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        if (period == null) {
            period = BudgetPeriod.MONTHLY;
        }
        alerts = alerts == null || alerts.isEmpty() ? AlertThreshold.defaults() : List.copyOf(alerts);
    }

    public static Budget of(ScopeType scopeType, String targetId, double amount, BudgetPeriod period) {
        return new Budget(null, null, scopeType, targetId, amount, period, null, null, null, null);
    }

    Budget created(Instant now) {
        return new Budget(id, name, scopeType, targetId, amount, period, now, alerts, now, now);
    }

    Budget updated(double newAmount, BudgetPeriod newPeriod, List<AlertThreshold> newAlerts, Instant now) {
        return new Budget(id, name, scopeType, targetId, newAmount,
                newPeriod != null ? newPeriod : period,
                periodStart,
                newAlerts != null ? newAlerts : alerts,
                createdAt, now);
    }
}
