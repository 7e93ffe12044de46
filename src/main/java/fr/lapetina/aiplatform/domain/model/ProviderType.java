package fr.lapetina.aiplatform.domain.model;

/**
 * How a provider fulfils a feature.
 */
public enum ProviderType {
    SELF_HOSTED("self_hosted"),
    THIRD_PARTY("third_party");

    private final String wireName;

    ProviderType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses either the wire name ({@code self_hosted}) or the enum name.
     */
    public static ProviderType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Provider type is required");
        }
        for (ProviderType type : values()) {
            if (type.wireName.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown provider type: " + value);
    }
}
