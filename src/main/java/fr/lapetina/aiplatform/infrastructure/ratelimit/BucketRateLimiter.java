package fr.lapetina.aiplatform.infrastructure.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps one {@link RateLimitBucket} per tenant and feature. Changing a
 * limit replaces the key's bucket with a full one.
 */
public final class BucketRateLimiter extends KeyedRateLimiter {

    /**
     * Builds a bucket for a per-minute limit at the given time.
     */
    @FunctionalInterface
    public interface BucketFactory {
        RateLimitBucket create(int limitPerMinute, long nowNanos);
    }

    private final String name;
    private final BucketFactory factory;
    private final Clock clock;
    private final Map<String, RateLimitBucket> buckets = new ConcurrentHashMap<>();

    public BucketRateLimiter(String name, BucketFactory factory, int defaultLimit, Clock clock) {
        super(defaultLimit);
        this.name = name;
        this.factory = factory;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean allow(String tenantId, String feature) {
        String key = key(tenantId, feature);
        long nowMillis = clock.millis();
        long now = Duration.ofMillis(nowMillis).toNanos();
        int limit = getLimit(tenantId, feature);
        maybeEvict(nowMillis);
        boolean[] admitted = new boolean[1];
        buckets.compute(key, (k, current) -> {
            RateLimitBucket bucket = current != null ? current : factory.create(limit, now);
            admitted[0] = bucket.tryAcquire(now);
            return bucket;
        });
        return admitted[0];
    }

    @Override
    public int getTrackedKeyCount() {
        return buckets.size();
    }

    @Override
    long currentMillis() {
        return clock.millis();
    }

    /**
     * A full bucket behaves like a new one, so dropping it changes nothing.
     */
    @Override
    int evictIdle(long nowMillis) {
        long now = Duration.ofMillis(nowMillis).toNanos();
        int evicted = 0;
        for (String key : buckets.keySet()) {
            boolean[] removed = new boolean[1];
            buckets.computeIfPresent(key, (k, bucket) -> {
                removed[0] = bucket.isIdle(now);
                return removed[0] ? null : bucket;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    void onLimitChanged(String key, int limitPerMinute) {
        buckets.remove(key);
    }
}
