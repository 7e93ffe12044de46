package fr.lapetina.aiplatform.infrastructure.ratelimit;

/**
 * Request rate admission per tenant and feature.
 *
 * Limits are expressed in requests per minute.
 */
public interface RateLimiter {

    String getName();

    /**
     * Consumes one permit when available.
     *
     * @return false if the tenant has exhausted its rate for the feature
     */
    boolean allow(String tenantId, String feature);

    int getLimit(String tenantId, String feature);

    void setLimit(String tenantId, String feature, int limitPerMinute);

    /**
     * Returns every tenant and feature to the default limit.
     */
    void clearLimits();

    /**
     * Forgets per-key state that no longer affects admission.
     *
     * @return number of keys dropped
     */
    int evictIdle();

    int getTrackedKeyCount();
}
