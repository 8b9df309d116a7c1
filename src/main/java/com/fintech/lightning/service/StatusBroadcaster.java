package com.fintech.lightning.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans events of one class (settled invoices, payment updates) out to every live subscriber.
 * <p>
 * Delivery never blocks: each subscriber buffers its own backlog, so a subscriber that
 * stops reading cannot hold up the producing loop or the other subscribers. Each
 * subscriber sees events in the order they were broadcast. Delivery is at-least-once,
 * so consumers should be idempotent on checking id and status.
 * <p>
 * With {@code maxPending > 0}, a subscriber whose backlog reaches that size is closed
 * and dropped instead of growing without bound.
 *
 * @param <T> event type
 */
@Slf4j
public class StatusBroadcaster<T> {

    private final String name;
    private final int maxPending;
    private final List<EventSubscription<T>> subscribers = new CopyOnWriteArrayList<>();
    private final Counter evictedCounter;

    public StatusBroadcaster(String name, int maxPending, MeterRegistry meterRegistry) {
        this.name = name;
        this.maxPending = maxPending;

        Gauge.builder("lightning.subscribers.active", subscribers, List::size)
                .description("Live subscribers per event stream")
                .tag("stream", name)
                .register(meterRegistry);

        this.evictedCounter = Counter.builder("lightning.subscribers.evicted")
                .description("Subscribers dropped for falling too far behind")
                .tag("stream", name)
                .register(meterRegistry);
    }

    /**
     * Registers a new, independent subscriber.
     */
    public EventSubscription<T> subscribe() {
        EventSubscription<T> subscription = new EventSubscription<>(name, this::remove);
        subscribers.add(subscription);
        log.debug("New {} subscriber, {} active", name, subscribers.size());
        return subscription;
    }

    /**
     * Hands the event to every current subscriber without waiting for any of them.
     *
     * @return number of subscribers the event was queued for
     */
    public int broadcast(T event) {
        int delivered = 0;
        for (EventSubscription<T> subscriber : subscribers) {
            if (maxPending > 0 && subscriber.getPendingCount() >= maxPending) {
                log.warn("Evicting {} subscriber with {} undelivered events", name, subscriber.getPendingCount());
                evictedCounter.increment();
                subscriber.close("evicted after " + maxPending + " undelivered events");
                continue;
            }
            if (subscriber.offer(event)) {
                delivered++;
            }
        }
        return delivered;
    }

    public int getSubscriberCount() {
        return subscribers.size();
    }

    public String getName() {
        return name;
    }

    private void remove(EventSubscription<T> subscription) {
        if (subscribers.remove(subscription)) {
            log.debug("{} subscriber removed, {} active", name, subscribers.size());
        }
    }
}
