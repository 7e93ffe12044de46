package fr.lapetina.aiplatform.infrastructure.budget;

import java.util.List;

/**
 * Fraction of a budget ({@code 0.7} = 70%) at which an alert fires.
 */
public record AlertThreshold(double at, AlertAction action, boolean enabled) {

    public AlertThreshold {
        if (at <= 0 || at > 1) {
            throw new IllegalArgumentException("Threshold must be in (0, 1]: " + at);
        }
        if (action == null) {
            action = AlertAction.NOTIFY;
        }
    }

    public static AlertThreshold of(double at, AlertAction action) {
        return new AlertThreshold(at, action, true);
    }

    /**
     * 70% notify, 90% switch to third party.
     */
    public static List<AlertThreshold> defaults() {
        return List.of(
                of(0.7, AlertAction.NOTIFY),
                of(0.9, AlertAction.SWITCH_TO_THIRD_PARTY)
        );
    }
}
