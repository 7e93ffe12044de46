package fr.lapetina.aiplatform.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Limit bookkeeping shared by the limiter implementations.
 *
 * Per-key state is created on first use from caller-supplied tenant and
 * feature names, so idle keys are swept at most once per minute from the
 * request path.
 */
abstract class KeyedRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(KeyedRateLimiter.class);

    static final long SWEEP_INTERVAL_MILLIS = 60_000L;

    private final Map<String, Integer> limits = new ConcurrentHashMap<>();
    private final AtomicLong lastSweepMillis = new AtomicLong();
    private final int defaultLimit;

    KeyedRateLimiter(int defaultLimit) {
        if (defaultLimit < 1) {
            throw new IllegalArgumentException("Default limit must be >= 1: " + defaultLimit);
        }
        this.defaultLimit = defaultLimit;
    }

    static String key(String tenantId, String feature) {
        return tenantId + ":" + feature;
    }

    @Override
    public int getLimit(String tenantId, String feature) {
        return limits.getOrDefault(key(tenantId, feature), defaultLimit);
    }

    @Override
    public void setLimit(String tenantId, String feature, int limitPerMinute) {
        if (limitPerMinute < 1) {
            throw new IllegalArgumentException("Limit must be >= 1: " + limitPerMinute);
        }
        String key = key(tenantId, feature);
        limits.put(key, limitPerMinute);
        onLimitChanged(key, limitPerMinute);
        log.info("Rate limit set: limiter={}, key={}, limitPerMinute={}", getName(), key, limitPerMinute);
    }

    @Override
    public void clearLimits() {
        for (String key : limits.keySet()) {
            limits.remove(key);
            onLimitChanged(key, defaultLimit);
        }
    }

    int getDefaultLimit() {
        return defaultLimit;
    }

    @Override
    public int evictIdle() {
        long now = currentMillis();
        lastSweepMillis.set(now);
        return evictIdle(now);
    }

    void maybeEvict(long nowMillis) {
        long last = lastSweepMillis.get();
        if (nowMillis - last >= SWEEP_INTERVAL_MILLIS && lastSweepMillis.compareAndSet(last, nowMillis)) {
            int evicted = evictIdle(nowMillis);
            if (evicted > 0) {
                log.debug("Idle rate limit keys evicted: limiter={}, evicted={}, remaining={}",
                        getName(), evicted, getTrackedKeyCount());
            }
        }
    }

    abstract long currentMillis();

    abstract int evictIdle(long nowMillis);

    void onLimitChanged(String key, int limitPerMinute) {
    }
}
