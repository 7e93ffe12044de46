package fr.lapetina.aiplatform.infrastructure.scaler;

/**
 * Result of one scaling evaluation. Not persisted.
 *
 * @param applied whether the cluster accepted the new replica count
 */
public record ScaleDecision(
        String featureId,
        ScaleAction action,
        int currentReplicas,
        int targetReplicas,
        ScaleMetrics metrics,
        String reason,
        boolean applied
) {

    static ScaleDecision none(String featureId, int current, ScaleMetrics metrics, String reason) {
        return new ScaleDecision(featureId, ScaleAction.NONE, current, current, metrics, reason, false);
    }

    ScaleDecision markApplied() {
        return new ScaleDecision(featureId, action, currentReplicas, targetReplicas, metrics, reason, true);
    }

    public boolean requiresChange() {
        return action != ScaleAction.NONE;
    }
}
