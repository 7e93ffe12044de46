package fr.lapetina.aiplatform.infrastructure.ratelimit;

/**
 * Holds up to {@code capacity} tokens, refilled continuously. A request takes one token.
 */
public final class TokenBucket implements RateLimitBucket {

    private final double capacity;
    private final double refillPerNano;
    private double tokens;
    private long lastRefill;

    public TokenBucket(int capacity, double refillPerSecond, long nowNanos) {
        if (capacity < 1 || refillPerSecond <= 0) {
            throw new IllegalArgumentException(
                    "Invalid token bucket: capacity=" + capacity + ", refillPerSecond=" + refillPerSecond);
        }
        this.capacity = capacity;
        this.refillPerNano = refillPerSecond / 1_000_000_000.0;
        this.tokens = capacity;
        this.lastRefill = nowNanos;
    }

    /**
     * Bucket allowing {@code limitPerMinute} requests per minute, bursting up to the same amount.
     */
    public static TokenBucket perMinute(int limitPerMinute, long nowNanos) {
        return new TokenBucket(limitPerMinute, limitPerMinute / 60.0, nowNanos);
    }

    @Override
    public synchronized boolean tryAcquire(long nowNanos) {
        refill(nowNanos);
        if (tokens >= 1.0) {
            tokens -= 1.0;
            return true;
        }
        return false;
    }

    @Override
    public synchronized double available(long nowNanos) {
        refill(nowNanos);
        return tokens;
    }

    @Override
    public synchronized boolean isIdle(long nowNanos) {
        refill(nowNanos);
        return tokens >= capacity;
    }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillPerNano);
            lastRefill = nowNanos;
        }
    }
}
