package fr.lapetina.aiplatform.infrastructure.budget;

import java.util.Locale;

/**
 * What a crossed threshold asks operators to do. Carried on alerts only;
 * admission is decided by the budget amount alone.
 */
public enum AlertAction {
    NOTIFY,
    SWITCH_TO_THIRD_PARTY,
    BLOCK;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AlertAction fromString(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
