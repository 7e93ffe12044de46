package fr.lapetina.aiplatform.infrastructure.budget;

import java.util.Locale;

/**
 * Granularity at which spend is tracked and limited.
 */
public enum ScopeType {
    GLOBAL("global"),
    SERVICE("service"),
    TENANT("tenant");

    private final String wireName;

    ScopeType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Builds the scope id for a target: {@code global}, {@code service:<feature>}
     * or {@code tenant:<id>}.
     */
    public String scopeId(String targetId) {
        if (this == GLOBAL) {
            return wireName;
        }
        if (targetId == null || targetId.isBlank()) {
            throw new IllegalArgumentException(wireName + " scope requires a target id");
        }
        return wireName + ":" + targetId;
    }

    public static ScopeType fromScopeId(String scopeId) {
        int colon = scopeId.indexOf(':');
        String prefix = colon < 0 ? scopeId : scopeId.substring(0, colon);
        return fromString(prefix);
    }

    public static ScopeType fromString(String value) {
        for (ScopeType type : values()) {
            if (type.wireName.equals(value.toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown budget scope type: " + value);
    }
}
