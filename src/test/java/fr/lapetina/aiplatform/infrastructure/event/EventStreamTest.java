package fr.lapetina.aiplatform.infrastructure.event;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class EventStreamTest {

    private EventStream<String> stream;

    @BeforeEach
    void setUp() {
        stream = new EventStream<>("test", 64, 2, "blocking");
    }

    @AfterEach
    void tearDown() {
        stream.close();
    }

    private static List<String> pollAll(EventWatch<String> watch, int expected) throws InterruptedException {
        List<String> received = new ArrayList<>();
        for (int i = 0; i < expected; i++) {
            Optional<String> event = watch.poll(Duration.ofSeconds(5));
            event.ifPresent(received::add);
        }
        return received;
    }

    @Test
    @DisplayName("should drop events published before start")
    void shouldDropBeforeStart() {
        assertThat(stream.publish("early")).isFalse();
        assertThat(stream.getDroppedCount()).isEqualTo(1);
        assertThat(stream.getPublishedCount()).isZero();
    }

    @Test
    @DisplayName("should fan out every event to every watch in order")
    void shouldFanOut() throws InterruptedException {
        stream.start();
        EventWatch<String> first = stream.watch();
        EventWatch<String> second = stream.watch();

        stream.publish("a");
        stream.publish("b");

        assertThat(pollAll(first, 2)).containsExactly("a", "b");
        assertThat(pollAll(second, 2)).containsExactly("a", "b");
        assertThat(stream.getPublishedCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("should drop the newest events for a slow watch only")
    void shouldDropNewestForSlowWatch() throws InterruptedException {
        stream.start();
        EventWatch<String> slow = stream.watch();

        for (int i = 1; i <= 5; i++) {
            stream.publish("e" + i);
        }

        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (slow.getDroppedCount() < 3 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }

        assertThat(slow.getDroppedCount()).isEqualTo(3);
        assertThat(slow.drain()).containsExactly("e1", "e2");
        assertThat(stream.getDroppedCount()).isZero();
    }

    @Test
    @DisplayName("should stop delivering to a closed watch")
    void shouldDetachClosedWatch() throws InterruptedException {
        stream.start();
        EventWatch<String> watch = stream.watch();
        assertThat(stream.getWatcherCount()).isEqualTo(1);

        watch.close();
        stream.publish("ignored");

        assertThat(stream.getWatcherCount()).isZero();
        assertThat(watch.isClosed()).isTrue();
        assertThat(watch.poll(Duration.ofMillis(50))).isEmpty();
    }

    @Test
    @DisplayName("should close open watches and refuse events after close")
    void shouldCloseWatchesOnStop() {
        stream.start();
        EventWatch<String> watch = stream.watch();

        stream.close();

        assertThat(watch.isClosed()).isTrue();
        assertThat(stream.publish("late")).isFalse();
    }
}
