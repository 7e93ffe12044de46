package fr.lapetina.aiplatform.infrastructure.provider;

import fr.lapetina.aiplatform.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CircuitBreakerTest {

    private MutableClock clock;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atMinuteBoundary();
        // 3 failures to open, 30s recovery, 2 trial successes to close
        circuitBreaker = new CircuitBreaker("sd-1", 3, Duration.ofSeconds(30), 2, clock);
    }

    private void open() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.allowRequest()).isTrue();
    }

    @Test
    @DisplayName("should open after threshold failures")
    void shouldOpenAfterThresholdFailures() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);

        circuitBreaker.recordFailure(); // Third failure hits threshold

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        assertThat(circuitBreaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should reset failure count on success")
    void shouldResetFailureCountOnSuccess() {
        circuitBreaker.recordFailure();
        circuitBreaker.recordFailure();
        assertThat(circuitBreaker.getConsecutiveFailures()).isEqualTo(2);

        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should stay OPEN until the recovery timeout elapses")
    void shouldStayOpenBeforeTimeout() {
        open();

        clock.advance(Duration.ofSeconds(29));

        assertThat(circuitBreaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should transition to HALF_OPEN after recovery timeout")
    void shouldTransitionToHalfOpenAfterTimeout() {
        open();

        clock.advance(Duration.ofSeconds(30));

        assertThat(circuitBreaker.allowRequest()).isTrue();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
    }

    @Test
    @DisplayName("should close after successful requests in HALF_OPEN")
    void shouldCloseAfterSuccessesInHalfOpen() {
        open();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.allowRequest();

        circuitBreaker.recordSuccess();
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.HALF_OPEN);
        circuitBreaker.recordSuccess();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should reopen on failure in HALF_OPEN and restart the timeout")
    void shouldReopenOnFailureInHalfOpen() {
        open();
        clock.advance(Duration.ofSeconds(30));
        circuitBreaker.allowRequest();

        circuitBreaker.recordFailure();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
        clock.advance(Duration.ofSeconds(10));
        assertThat(circuitBreaker.allowRequest()).isFalse();
    }

    @Test
    @DisplayName("should close on reset")
    void shouldReset() {
        open();

        circuitBreaker.reset();

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("should reject thresholds below one")
    void shouldRejectInvalidThresholds() {
        assertThatThrownBy(() -> new CircuitBreaker("sd-1", 0, Duration.ofSeconds(1), 1, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
