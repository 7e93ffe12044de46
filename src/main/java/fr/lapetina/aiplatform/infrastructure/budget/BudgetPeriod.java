package fr.lapetina.aiplatform.infrastructure.budget;

import java.util.Locale;

public enum BudgetPeriod {
    DAILY,
    WEEKLY,
    MONTHLY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static BudgetPeriod fromString(String value) {
        if (value == null || value.isBlank()) {
            return MONTHLY;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
