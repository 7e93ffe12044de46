package fr.lapetina.aiplatform.infrastructure.budget;

import java.time.Instant;

/**
 * Accumulated spend for a scope in the current period.
 */
public record Spending(String scopeId, double amount, Instant periodStart, Instant updatedAt) {

    public static Spending empty(String scopeId, Instant now) {
        return new Spending(scopeId, 0.0, now, now);
    }

    Spending add(double cost, Instant now) {
        return new Spending(scopeId, amount + cost, periodStart, now);
    }
}
