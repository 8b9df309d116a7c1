package com.fintech.lightning.service;

import com.fintech.lightning.exception.SubscriptionClosedException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Receive side of one subscriber to a {@link StatusBroadcaster}.
 * <p>
 * Events are buffered per subscriber in emission order. After {@link #close()} the
 * events already buffered are still handed out; then every read fails with
 * {@link SubscriptionClosedException}.
 *
 * @param <T> event type
 */
public class EventSubscription<T> implements AutoCloseable {

    private static final Optional<?> END = Optional.empty();

    private final String stream;
    private final BlockingQueue<Optional<T>> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final Consumer<EventSubscription<T>> onClose;
    // Orders offers against the end marker
    private final Object lock = new Object();

    private volatile String closeReason = "subscription closed";

    EventSubscription(String stream, Consumer<EventSubscription<T>> onClose) {
        this.stream = stream;
        this.onClose = onClose;
    }

    /**
     * Blocks until the next event is available.
     *
     * @throws SubscriptionClosedException once the subscription is closed and drained
     */
    public T take() throws InterruptedException {
        return unwrap(queue.take());
    }

    /**
     * Waits up to {@code timeout} for the next event.
     *
     * @return the event, or empty if none arrived in time
     * @throws SubscriptionClosedException once the subscription is closed and drained
     */
    public Optional<T> poll(Duration timeout) throws InterruptedException {
        Optional<T> next = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (next == null) {
            return Optional.empty();
        }
        return Optional.of(unwrap(next));
    }

    /**
     * Stops delivery and detaches from the broadcaster. Idempotent.
     */
    @Override
    public void close() {
        close("subscription closed");
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Events buffered but not yet read.
     */
    public int getPendingCount() {
        return closed.get() ? Math.max(0, queue.size() - 1) : queue.size();
    }

    public String getStream() {
        return stream;
    }

    boolean offer(T event) {
        synchronized (lock) {
            if (closed.get()) {
                return false;
            }
            return queue.offer(Optional.of(event));
        }
    }

    @SuppressWarnings("unchecked")
    void close(String reason) {
        synchronized (lock) {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            closeReason = reason;
            queue.add((Optional<T>) END);
        }
        onClose.accept(this);
    }

    @SuppressWarnings("unchecked")
    private T unwrap(Optional<T> next) {
        if (next.isEmpty()) {
            // Keep the marker in place so every later read fails as well
            queue.add((Optional<T>) END);
            throw new SubscriptionClosedException(stream + ": " + closeReason);
        }
        return next.get();
    }
}
