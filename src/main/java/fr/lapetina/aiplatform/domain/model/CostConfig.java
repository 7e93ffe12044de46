package fr.lapetina.aiplatform.domain.model;

import java.util.Map;
import java.util.Optional;

/**
 * Pricing of a feature: hourly price of a self-hosted instance and
 * per-request price per third-party provider id.
 */
public record CostConfig(double selfHostedPerHour, Map<String, Double> thirdPartyPerRequest) {

    public static final CostConfig FREE = new CostConfig(0, Map.of());

    public CostConfig {
        thirdPartyPerRequest = thirdPartyPerRequest != null ? Map.copyOf(thirdPartyPerRequest) : Map.of();
    }

    public Optional<Double> perRequest(String providerId) {
        return Optional.ofNullable(thirdPartyPerRequest.get(providerId));
    }

    /**
     * Worst-case per-request price, used as the admission estimate.
     */
    public double highestPerRequest() {
        return thirdPartyPerRequest.values().stream()
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);
    }

    /**
     * Prorated self-hosted price for the given execution time.
     */
    public double selfHostedCost(long executionMillis) {
        return selfHostedPerHour * executionMillis / 3_600_000d;
    }
}
