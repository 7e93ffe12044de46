package fr.lapetina.aiplatform.infrastructure.ratelimit;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One-minute sliding window approximated from the current and previous
 * fixed windows: the previous count is weighted by the part of it still
 * inside the sliding window.
 */
public final class SlidingWindowRateLimiter extends KeyedRateLimiter {

    public static final String NAME = "sliding-window";

    private static final long WINDOW_MILLIS = 60_000L;

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public SlidingWindowRateLimiter(int defaultLimit, Clock clock) {
        super(defaultLimit);
        this.clock = clock;
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public boolean allow(String tenantId, String feature) {
        String key = key(tenantId, feature);
        int limit = getLimit(tenantId, feature);
        long now = clock.millis();
        maybeEvict(now);
        // Acquire inside compute so a concurrent eviction cannot drop the increment
        boolean[] admitted = new boolean[1];
        windows.compute(key, (k, current) -> {
            Window window = current != null ? current : new Window();
            admitted[0] = window.tryAcquire(now, limit);
            return window;
        });
        return admitted[0];
    }

    @Override
    public int getTrackedKeyCount() {
        return windows.size();
    }

    @Override
    long currentMillis() {
        return clock.millis();
    }

    @Override
    int evictIdle(long nowMillis) {
        int evicted = 0;
        for (String key : windows.keySet()) {
            boolean[] removed = new boolean[1];
            windows.computeIfPresent(key, (k, window) -> {
                removed[0] = window.isIdle(nowMillis);
                return removed[0] ? null : window;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        return evicted;
    }

    private static final class Window {
        private long windowIndex = Long.MIN_VALUE;
        private long currentCount;
        private long previousCount;

        synchronized boolean tryAcquire(long nowMillis, int limit) {
            long index = nowMillis / WINDOW_MILLIS;
            if (index != windowIndex) {
                previousCount = index == windowIndex + 1 ? currentCount : 0;
                currentCount = 0;
                windowIndex = index;
            }
            double elapsed = (double) (nowMillis % WINDOW_MILLIS) / WINDOW_MILLIS;
            double estimate = previousCount * (1.0 - elapsed) + currentCount;
            if (estimate >= limit) {
                return false;
            }
            currentCount++;
            return true;
        }

        // Neither the current nor the previous window holds any count
        synchronized boolean isIdle(long nowMillis) {
            return nowMillis / WINDOW_MILLIS > windowIndex + 1;
        }
    }
}
