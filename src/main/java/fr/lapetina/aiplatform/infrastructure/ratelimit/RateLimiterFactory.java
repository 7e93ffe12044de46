package fr.lapetina.aiplatform.infrastructure.ratelimit;

import java.time.Clock;
import java.util.Locale;

/**
 * Creates a limiter by algorithm name.
 *
 * Available algorithms:
 * - sliding-window (default)
 * - token-bucket
 * - leaky-bucket
 */
public final class RateLimiterFactory {

    public static final int DEFAULT_LIMIT_PER_MINUTE = 100;

    private RateLimiterFactory() {
    }

    public static RateLimiter create(String algorithm, int defaultLimit, Clock clock) {
        String name = algorithm == null ? SlidingWindowRateLimiter.NAME : algorithm.toLowerCase(Locale.ROOT);
        return switch (name) {
            case SlidingWindowRateLimiter.NAME -> new SlidingWindowRateLimiter(defaultLimit, clock);
            case "token-bucket" -> new BucketRateLimiter("token-bucket", TokenBucket::perMinute, defaultLimit, clock);
            case "leaky-bucket" -> new BucketRateLimiter("leaky-bucket", LeakyBucket::perMinute, defaultLimit, clock);
            default -> throw new IllegalArgumentException("Unknown rate limit algorithm: " + algorithm);
        };
    }

    public static RateLimiter createDefault() {
        return create(SlidingWindowRateLimiter.NAME, DEFAULT_LIMIT_PER_MINUTE, Clock.systemUTC());
    }
}
