package fr.lapetina.aiplatform.infrastructure.scheduling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduledLoopTest {

    @Test
    @DisplayName("should run one tick on the calling thread")
    void shouldRunOnce() {
        AtomicInteger runs = new AtomicInteger();
        try (ScheduledLoop loop = new ScheduledLoop("manual", Duration.ofHours(1), runs::incrementAndGet)) {
            assertThat(loop.runOnce()).isTrue();
            assertThat(loop.runOnce()).isTrue();

            assertThat(runs.get()).isEqualTo(2);
            assertThat(loop.getTickCount()).isEqualTo(2);
            assertThat(loop.isRunning()).isFalse();
        }
    }

    @Test
    @DisplayName("should count a failing tick and keep going")
    void shouldSurviveFailure() {
        AtomicInteger runs = new AtomicInteger();
        try (ScheduledLoop loop = new ScheduledLoop("flaky", Duration.ofHours(1), () -> {
            if (runs.incrementAndGet() == 1) {
                throw new IllegalStateException("boom");
            }
        })) {
            assertThat(loop.runOnce()).isFalse();
            assertThat(loop.runOnce()).isTrue();
            assertThat(loop.getFailureCount()).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should tick repeatedly once started")
    void shouldTickWhenStarted() throws InterruptedException {
        CountDownLatch ticks = new CountDownLatch(3);
        try (ScheduledLoop loop = new ScheduledLoop("fast", Duration.ofMillis(20), ticks::countDown)) {
            loop.start();
            loop.start(); // Second start is a no-op

            assertThat(loop.isRunning()).isTrue();
            assertThat(ticks.await(5, TimeUnit.SECONDS)).isTrue();

            loop.close();
            assertThat(loop.isRunning()).isFalse();
        }
    }

    @Test
    @DisplayName("should reject a non positive interval")
    void shouldRejectZeroInterval() {
        assertThatThrownBy(() -> new ScheduledLoop("bad", Duration.ZERO, () -> { }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
