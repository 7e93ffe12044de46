package fr.lapetina.aiplatform.infrastructure.event;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort notification stream backed by an LMAX Disruptor ring buffer.
 *
 * OVERFLOW POLICY: drop-newest. {@link #publish(Object)} claims a slot with
 * {@code tryPublishEvent} and never blocks; when the ring is full the event
 * is discarded and counted. A single consumer thread fans every event out
 * to the open {@link EventWatch}es, each of which applies the same policy
 * to its own bounded queue. Consumers must tolerate gaps.
 *
 * PRODUCER TYPE: MULTI, since request threads and background loops publish
 * concurrently.
 */
public final class EventStream<T> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventStream.class);

    private final String name;
    private final int watchCapacity;
    private final Disruptor<EventSlot<T>> disruptor;
    private final RingBuffer<EventSlot<T>> ringBuffer;
    private final List<EventWatch<T>> watches = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();

    private final EventTranslatorOneArg<EventSlot<T>, T> translator = (slot, sequence, payload) -> slot.set(payload);

    public EventStream(String name, int ringBufferSize, int watchCapacity, String waitStrategy) {
        this.name = name;
        this.watchCapacity = watchCapacity;
        this.disruptor = new Disruptor<>(
                EventSlot::new,
                ringBufferSize,
                new StreamThreadFactory(name),
                ProducerType.MULTI,
                createWaitStrategy(waitStrategy)
        );
        this.disruptor.handleEventsWith(new FanOutHandler());
        this.disruptor.setDefaultExceptionHandler(new StreamExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        log.info("EventStream created: name={}, ringBufferSize={}, watchCapacity={}",
                name, ringBufferSize, watchCapacity);
    }

    public EventStream(String name) {
        this(name, 128, 10, "blocking");
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("EventStream started: name={}", name);
        }
    }

    /**
     * Publishes without blocking.
     *
     * @return false if the event was dropped because the stream is full or stopped
     */
    public boolean publish(T event) {
        if (!running.get()) {
            dropped.incrementAndGet();
            return false;
        }
        if (ringBuffer.tryPublishEvent(translator, event)) {
            published.incrementAndGet();
            return true;
        }
        long total = dropped.incrementAndGet();
        log.debug("Event dropped, stream full: name={}, droppedTotal={}", name, total);
        return false;
    }

    /**
     * Opens a new watch receiving every event published from now on.
     */
    public EventWatch<T> watch() {
        EventWatch<T> watch = new EventWatch<>(this, watchCapacity);
        watches.add(watch);
        log.debug("Watch opened: name={}, watchers={}", name, watches.size());
        return watch;
    }

    void detach(EventWatch<T> watch) {
        watches.remove(watch);
        log.debug("Watch closed: name={}, watchers={}", name, watches.size());
    }

    public String getName() {
        return name;
    }

    public long getPublishedCount() {
        return published.get();
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    public int getWatcherCount() {
        return watches.size();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            try {
                disruptor.shutdown(5, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("EventStream shutdown timed out, halting: name={}", name);
                disruptor.halt();
            }
            for (EventWatch<T> watch : watches) {
                watch.close();
            }
            log.info("EventStream stopped: name={}, published={}, dropped={}",
                    name, published.get(), dropped.get());
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        if (name == null) {
            return new BlockingWaitStrategy();
        }
        return switch (name.toLowerCase()) {
            case "blocking" -> new BlockingWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    private final class FanOutHandler implements EventHandler<EventSlot<T>> {
        @Override
        public void onEvent(EventSlot<T> slot, long sequence, boolean endOfBatch) {
            T event = slot.get();
            slot.clear();
            if (event == null) {
                return;
            }
            for (EventWatch<T> watch : watches) {
                watch.offer(event);
            }
        }
    }

    private static class StreamThreadFactory implements ThreadFactory {
        private final String name;

        StreamThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "events-" + name);
            t.setDaemon(true);
            return t;
        }
    }

    private final class StreamExceptionHandler implements ExceptionHandler<EventSlot<T>> {

        @Override
        public void handleEventException(Throwable ex, long sequence, EventSlot<T> slot) {
            log.error("Exception delivering event: name={}, sequence={}", name, sequence, ex);
            slot.clear();
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception starting event stream: name={}", name, ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception stopping event stream: name={}", name, ex);
        }
    }
}
