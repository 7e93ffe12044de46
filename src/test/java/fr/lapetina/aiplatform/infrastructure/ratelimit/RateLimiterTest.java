package fr.lapetina.aiplatform.infrastructure.ratelimit;

import fr.lapetina.aiplatform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class RateLimiterTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atMinuteBoundary();
    }

    private static int allowed(RateLimiter limiter, String tenant, String feature, int attempts) {
        int count = 0;
        for (int i = 0; i < attempts; i++) {
            if (limiter.allow(tenant, feature)) {
                count++;
            }
        }
        return count;
    }

    @Nested
    @DisplayName("SlidingWindowRateLimiter")
    class SlidingWindowTests {

        private SlidingWindowRateLimiter limiter;

        @BeforeEach
        void setUp() {
            limiter = new SlidingWindowRateLimiter(5, clock);
        }

        @Test
        @DisplayName("should allow up to the limit within one window")
        void shouldAllowUpToLimit() {
            assertThat(allowed(limiter, "acme", "text_to_image", 5)).isEqualTo(5);
            assertThat(limiter.allow("acme", "text_to_image")).isFalse();
        }

        @Test
        @DisplayName("should weight the previous window by its overlap")
        void shouldWeightPreviousWindow() {
            allowed(limiter, "acme", "text_to_image", 5);

            // Start of the next window: the previous one still counts in full
            clock.advance(Duration.ofSeconds(60));
            assertThat(limiter.allow("acme", "text_to_image")).isFalse();

            // Halfway: 5 * 0.5 = 2.5 carried over
            clock.advance(Duration.ofSeconds(30));
            assertThat(allowed(limiter, "acme", "text_to_image", 10)).isEqualTo(3);
        }

        @Test
        @DisplayName("should forget counts older than one window")
        void shouldForgetOldWindows() {
            allowed(limiter, "acme", "text_to_image", 5);

            clock.advance(Duration.ofSeconds(125));

            assertThat(allowed(limiter, "acme", "text_to_image", 10)).isEqualTo(5);
        }

        @Test
        @DisplayName("should count tenants and features separately")
        void shouldIsolateKeys() {
            allowed(limiter, "acme", "text_to_image", 5);

            assertThat(limiter.allow("globex", "text_to_image")).isTrue();
            assertThat(limiter.allow("acme", "text_generation")).isTrue();
            assertThat(limiter.allow("acme", "text_to_image")).isFalse();
        }

        @Test
        @DisplayName("should apply a per tenant override")
        void shouldApplyOverride() {
            limiter.setLimit("acme", "text_generation", 2);

            assertThat(limiter.getLimit("acme", "text_generation")).isEqualTo(2);
            assertThat(limiter.getLimit("globex", "text_generation")).isEqualTo(5);
            assertThat(allowed(limiter, "acme", "text_generation", 5)).isEqualTo(2);

            limiter.clearLimits();
            assertThat(limiter.getLimit("acme", "text_generation")).isEqualTo(5);
        }

        @Test
        @DisplayName("should never admit more than the limit under contention")
        void shouldHoldUnderContention() throws InterruptedException {
            SlidingWindowRateLimiter shared = new SlidingWindowRateLimiter(500, clock);
            int threads = 10;
            AtomicInteger admitted = new AtomicInteger();
            CountDownLatch done = new CountDownLatch(threads);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                for (int t = 0; t < threads; t++) {
                    executor.submit(() -> {
                        try {
                            admitted.addAndGet(allowed(shared, "acme", "text_to_image", 100));
                        } finally {
                            done.countDown();
                        }
                    });
                }
                assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
            } finally {
                executor.shutdownNow();
            }

            assertThat(admitted.get()).isEqualTo(500);
        }
    }

    @Nested
    @DisplayName("Token bucket")
    class TokenBucketTests {

        @Test
        @DisplayName("should allow a burst of the limit then refill continuously")
        void shouldBurstThenRefill() {
            RateLimiter limiter = RateLimiterFactory.create("token-bucket", 60, clock);

            assertThat(allowed(limiter, "acme", "text_to_image", 70)).isEqualTo(60);

            clock.advance(Duration.ofMillis(1500));
            assertThat(allowed(limiter, "acme", "text_to_image", 5)).isEqualTo(1);
        }

        @Test
        @DisplayName("should not refill above capacity")
        void shouldCapAtCapacity() {
            TokenBucket bucket = TokenBucket.perMinute(10, 0);

            assertThat(bucket.tryAcquire(0)).isTrue();
            assertThat(bucket.available(Duration.ofMinutes(10).toNanos())).isEqualTo(10.0);
        }

        @Test
        @DisplayName("should start a full bucket when the limit changes")
        void shouldResetOnLimitChange() {
            RateLimiter limiter = RateLimiterFactory.create("token-bucket", 3, clock);
            allowed(limiter, "acme", "text_to_image", 3);

            limiter.setLimit("acme", "text_to_image", 4);

            assertThat(allowed(limiter, "acme", "text_to_image", 10)).isEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Leaky bucket")
    class LeakyBucketTests {

        @Test
        @DisplayName("should reject on overflow and drain at a constant rate")
        void shouldDrain() {
            RateLimiter limiter = RateLimiterFactory.create("leaky-bucket", 60, clock);

            assertThat(allowed(limiter, "acme", "text_to_image", 61)).isEqualTo(60);

            clock.advance(Duration.ofMillis(2500));
            assertThat(allowed(limiter, "acme", "text_to_image", 5)).isEqualTo(2);
        }

        @Test
        @DisplayName("should report free room")
        void shouldReportAvailable() {
            LeakyBucket bucket = LeakyBucket.perMinute(6, 0);
            bucket.tryAcquire(0);
            bucket.tryAcquire(0);

            assertThat(bucket.available(0)).isEqualTo(4.0);
            assertThat(bucket.available(Duration.ofSeconds(10).toNanos())).isCloseTo(5.0, within(1e-9));
        }
    }

    @Nested
    @DisplayName("Idle key eviction")
    class EvictionTests {

        @Test
        @DisplayName("should forget sliding windows once they stop counting")
        void shouldEvictIdleWindows() {
            RateLimiter limiter = new SlidingWindowRateLimiter(5, clock);
            for (int i = 0; i < 1000; i++) {
                limiter.allow("tenant-" + i, "feature-" + i);
            }
            assertThat(limiter.getTrackedKeyCount()).isEqualTo(1000);

            // Past the previous window the old counts no longer matter
            clock.advance(Duration.ofSeconds(125));
            limiter.allow("acme", "text_to_image");

            assertThat(limiter.getTrackedKeyCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should keep keys that still weigh on admission")
        void shouldKeepActiveWindows() {
            RateLimiter limiter = new SlidingWindowRateLimiter(5, clock);
            allowed(limiter, "acme", "text_to_image", 5);

            clock.advance(Duration.ofSeconds(70));
            assertThat(limiter.evictIdle()).isZero();

            // 5 * (50/60) still carried over from the previous window
            assertThat(allowed(limiter, "acme", "text_to_image", 5)).isEqualTo(1);
        }

        @Test
        @DisplayName("should drop refilled token buckets without changing admission")
        void shouldEvictFullTokenBuckets() {
            RateLimiter limiter = RateLimiterFactory.create("token-bucket", 60, clock);
            allowed(limiter, "acme", "text_to_image", 60);
            limiter.allow("globex", "text_to_image");

            // globex is full again, acme is still refilling
            clock.advance(Duration.ofSeconds(30));
            assertThat(limiter.evictIdle()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(31));
            assertThat(limiter.evictIdle()).isEqualTo(1);
            assertThat(limiter.getTrackedKeyCount()).isZero();
            assertThat(allowed(limiter, "acme", "text_to_image", 70)).isEqualTo(60);
        }

        @Test
        @DisplayName("should drop drained leaky buckets")
        void shouldEvictDrainedLeakyBuckets() {
            RateLimiter limiter = RateLimiterFactory.create("leaky-bucket", 60, clock);
            allowed(limiter, "acme", "text_to_image", 10);

            clock.advance(Duration.ofSeconds(5));
            assertThat(limiter.evictIdle()).isZero();

            clock.advance(Duration.ofSeconds(6));
            assertThat(limiter.evictIdle()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("RateLimiterFactory")
    class FactoryTests {

        @Test
        @DisplayName("should default to the sliding window")
        void shouldDefaultToSlidingWindow() {
            assertThat(RateLimiterFactory.create(null, 10, clock).getName()).isEqualTo("sliding-window");
            assertThat(RateLimiterFactory.createDefault().getLimit("any", "any"))
                    .isEqualTo(RateLimiterFactory.DEFAULT_LIMIT_PER_MINUTE);
        }

        @Test
        @DisplayName("should reject unknown algorithms and invalid limits")
        void shouldRejectInvalid() {
            assertThatThrownBy(() -> RateLimiterFactory.create("fixed-window", 10, clock))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RateLimiterFactory.create("sliding-window", 0, clock))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> RateLimiterFactory.createDefault().setLimit("acme", "x", 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
