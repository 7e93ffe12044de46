package fr.lapetina.aiplatform.infrastructure.event;

/**
 * Pre-allocated ring buffer entry carrying one published payload.
 *
 * Instances are reused by the ring buffer: {@link #clear()} drops the
 * reference once the payload has been fanned out.
 */
final class EventSlot<T> {

    private T payload;

    void set(T payload) {
        this.payload = payload;
    }

    T get() {
        return payload;
    }

    void clear() {
        this.payload = null;
    }
}
