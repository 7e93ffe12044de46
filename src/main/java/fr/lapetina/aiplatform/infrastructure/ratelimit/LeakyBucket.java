package fr.lapetina.aiplatform.infrastructure.ratelimit;

/**
 * Meter variant of the leaky bucket: each request adds one unit, the level
 * drains at a constant rate, and a request that would overflow is rejected.
 */
public final class LeakyBucket implements RateLimitBucket {

    private final double capacity;
    private final double leakPerNano;
    private double level;
    private long lastLeak;

    public LeakyBucket(int capacity, double leakPerSecond, long nowNanos) {
        if (capacity < 1 || leakPerSecond <= 0) {
            throw new IllegalArgumentException(
                    "Invalid leaky bucket: capacity=" + capacity + ", leakPerSecond=" + leakPerSecond);
        }
        this.capacity = capacity;
        this.leakPerNano = leakPerSecond / 1_000_000_000.0;
        this.level = 0;
        this.lastLeak = nowNanos;
    }

    public static LeakyBucket perMinute(int limitPerMinute, long nowNanos) {
        return new LeakyBucket(limitPerMinute, limitPerMinute / 60.0, nowNanos);
    }

    @Override
    public synchronized boolean tryAcquire(long nowNanos) {
        leak(nowNanos);
        if (level + 1.0 <= capacity) {
            level += 1.0;
            return true;
        }
        return false;
    }

    @Override
    public synchronized double available(long nowNanos) {
        leak(nowNanos);
        return capacity - level;
    }

    @Override
    public synchronized boolean isIdle(long nowNanos) {
        leak(nowNanos);
        return level <= 0;
    }

    private void leak(long nowNanos) {
        long elapsed = nowNanos - lastLeak;
        if (elapsed > 0) {
            level = Math.max(0, level - elapsed * leakPerNano);
            lastLeak = nowNanos;
        }
    }
}
