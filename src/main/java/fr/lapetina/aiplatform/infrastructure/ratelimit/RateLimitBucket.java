package fr.lapetina.aiplatform.infrastructure.ratelimit;

/**
 * Single-key admission primitive. Implementations are thread-safe.
 */
public interface RateLimitBucket {

    boolean tryAcquire(long nowNanos);

    /**
     * Permits that could be taken right now.
     */
    double available(long nowNanos);

    /**
     * True when the bucket is back to the state a new one starts in.
     */
    boolean isIdle(long nowNanos);
}
