package fr.lapetina.aiplatform.infrastructure.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-instance circuit breaker on the self-hosted call path.
 *
 * States:
 * - CLOSED: calls pass through
 * - OPEN: too many consecutive failures, calls fail fast
 * - HALF_OPEN: recovery timeout elapsed, trial calls pass until enough succeed
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    public enum State {
        CLOSED,
        OPEN,
        HALF_OPEN
    }

    private final String instanceId;
    private final int failureThreshold;
    private final Duration recoveryTimeout;
    private final int halfOpenSuccessThreshold;
    private final Clock clock;

    private final AtomicReference<State> state = new AtomicReference<>(State.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger halfOpenSuccesses = new AtomicInteger();
    private volatile Instant openedAt;

    public CircuitBreaker(String instanceId, int failureThreshold, Duration recoveryTimeout,
                          int halfOpenSuccessThreshold, Clock clock) {
        if (failureThreshold < 1 || halfOpenSuccessThreshold < 1) {
            throw new IllegalArgumentException("Circuit breaker thresholds must be >= 1");
        }
        this.instanceId = instanceId;
        this.failureThreshold = failureThreshold;
        this.recoveryTimeout = recoveryTimeout;
        this.halfOpenSuccessThreshold = halfOpenSuccessThreshold;
        this.clock = clock;
    }

    public CircuitBreaker(String instanceId) {
        this(instanceId, 5, Duration.ofSeconds(30), 3, Clock.systemUTC());
    }

    /**
     * @return false while the circuit is open
     */
    public boolean allowRequest() {
        return getState() != State.OPEN;
    }

    public void recordSuccess() {
        State current = state.get();
        if (current == State.CLOSED) {
            consecutiveFailures.set(0);
        } else if (current == State.HALF_OPEN
                && halfOpenSuccesses.incrementAndGet() >= halfOpenSuccessThreshold
                && state.compareAndSet(State.HALF_OPEN, State.CLOSED)) {
            consecutiveFailures.set(0);
            log.info("Circuit breaker closed after recovery: instanceId={}", instanceId);
        }
    }

    public void recordFailure() {
        State current = state.get();
        if (current == State.HALF_OPEN) {
            if (state.compareAndSet(State.HALF_OPEN, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker reopened on trial failure: instanceId={}", instanceId);
            }
            return;
        }
        if (current == State.CLOSED) {
            int failures = consecutiveFailures.incrementAndGet();
            if (failures >= failureThreshold && state.compareAndSet(State.CLOSED, State.OPEN)) {
                openedAt = clock.instant();
                log.warn("Circuit breaker opened: instanceId={}, consecutiveFailures={}", instanceId, failures);
            }
        }
    }

    public State getState() {
        if (state.get() == State.OPEN && openedAt != null
                && !clock.instant().isBefore(openedAt.plus(recoveryTimeout))
                && state.compareAndSet(State.OPEN, State.HALF_OPEN)) {
            halfOpenSuccesses.set(0);
            log.info("Circuit breaker half-open: instanceId={}", instanceId);
        }
        return state.get();
    }

    /**
     * Closes the circuit and forgets past failures.
     */
    public void reset() {
        state.set(State.CLOSED);
        consecutiveFailures.set(0);
        halfOpenSuccesses.set(0);
        openedAt = null;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    public String getInstanceId() {
        return instanceId;
    }

    @Override
    public String toString() {
        return "CircuitBreaker{instanceId='" + instanceId + "', state=" + state.get()
                + ", failures=" + consecutiveFailures.get() + '}';
    }
}
