package fr.lapetina.aiplatform.domain.model;

/**
 * Health state of a registered service instance.
 *
 * <pre>
 * HEALTHY   &lt;-&gt; DEGRADED    (heartbeat error rate)
 * HEALTHY/DEGRADED -&gt; UNHEALTHY  (heartbeat timeout sweep)
 * HEALTHY/DEGRADED/UNHEALTHY -&gt; DRAINING  (shutdown)
 * DRAINING  -&gt; TERMINATED  (external confirmation)
 * </pre>
 */
public enum HealthState {
    HEALTHY("healthy"),
    DEGRADED("degraded"),
    UNHEALTHY("unhealthy"),
    DRAINING("draining"),
    TERMINATED("terminated");

    private final String wireName;

    HealthState(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Lowercase name used on the registration protocol.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * True when the instance still takes part in heartbeat bookkeeping.
     */
    public boolean isMonitored() {
        return this != DRAINING && this != TERMINATED;
    }

    public boolean isTerminal() {
        return this == TERMINATED;
    }
}
