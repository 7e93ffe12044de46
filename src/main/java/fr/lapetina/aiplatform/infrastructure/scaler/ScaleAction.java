package fr.lapetina.aiplatform.infrastructure.scaler;

import java.util.Locale;

public enum ScaleAction {
    NONE,
    SCALE_UP,
    SCALE_DOWN,
    SCALE_TO_ZERO;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
