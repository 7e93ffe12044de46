package fr.lapetina.aiplatform.infrastructure.scheduling;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A recurring background task with an explicit lifecycle.
 *
 * The task runs on a dedicated daemon thread with a fixed delay between
 * ticks. A tick that throws is logged and the schedule continues.
 * {@link #runOnce()} executes one tick on the caller's thread, which is how
 * tests drive the loop without timers.
 */
public final class ScheduledLoop implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScheduledLoop.class);

    private final String name;
    private final Duration interval;
    private final Runnable task;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    private ScheduledExecutorService scheduler;

    public ScheduledLoop(String name, Duration interval, Runnable task) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("Interval must be positive: " + name);
        }
        this.name = name;
        this.interval = interval;
        this.task = task;
    }

    /**
     * Starts the schedule. The first tick runs after one interval.
     */
    public synchronized void start() {
        if (running.compareAndSet(false, true)) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, name);
                t.setDaemon(true);
                return t;
            });
            scheduler.scheduleWithFixedDelay(
                    this::runOnce,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Scheduled loop started: name={}, interval={}", name, interval);
        }
    }

    /**
     * Runs one tick now.
     *
     * @return false if the tick failed
     */
    public boolean runOnce() {
        ticks.incrementAndGet();
        try {
            task.run();
            return true;
        } catch (RuntimeException e) {
            long total = failures.incrementAndGet();
            log.error("Scheduled loop tick failed, continuing: name={}, failures={}", name, total, e);
            return false;
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public long getTickCount() {
        return ticks.get();
    }

    public long getFailureCount() {
        return failures.get();
    }

    @Override
    public synchronized void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Scheduled loop stopped: name={}", name);
        }
    }
}
