package fr.lapetina.aiplatform.infrastructure.event;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One consumer's view of an {@link EventStream}.
 *
 * Events are buffered in a bounded queue. When the queue is full the newest
 * event is dropped for this watcher only. Closing the watch detaches it from
 * the stream and discards anything still buffered.
 */
public final class EventWatch<T> implements AutoCloseable {

    private final EventStream<T> stream;
    private final BlockingQueue<T> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();

    EventWatch(EventStream<T> stream, int capacity) {
        this.stream = stream;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    void offer(T event) {
        if (closed.get()) {
            return;
        }
        if (!queue.offer(event)) {
            dropped.incrementAndGet();
        }
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or empty on timeout or once the watch is closed
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        if (closed.get()) {
            return Optional.empty();
        }
        return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }

    /**
     * Removes and returns every buffered event without waiting.
     */
    public List<T> drain() {
        List<T> events = new ArrayList<>();
        queue.drainTo(events);
        return events;
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            stream.detach(this);
            queue.clear();
        }
    }
}
