package com.fintech.lightning.service;

import com.fintech.lightning.exception.SubscriptionClosedException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for StatusBroadcaster and EventSubscription.
 */
class StatusBroadcasterTest {

    private static final Duration WAIT = Duration.ofSeconds(2);

    private SimpleMeterRegistry meterRegistry;
    private StatusBroadcaster<String> broadcaster;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        broadcaster = new StatusBroadcaster<>("test", 0, meterRegistry);
    }

    @Nested
    @DisplayName("Fan-out Tests")
    class FanOutTests {

        @Test
        @DisplayName("Every subscriber receives every event in emission order")
        void everySubscriberReceivesEveryEventInOrder() throws Exception {
            List<EventSubscription<String>> subscriptions = List.of(
                    broadcaster.subscribe(), broadcaster.subscribe(), broadcaster.subscribe());

            for (int i = 0; i < 100; i++) {
                assertThat(broadcaster.broadcast("event-" + i)).isEqualTo(3);
            }

            for (EventSubscription<String> subscription : subscriptions) {
                for (int i = 0; i < 100; i++) {
                    assertThat(subscription.take()).isEqualTo("event-" + i);
                }
            }
        }

        @Test
        @DisplayName("A subscriber that never reads does not hold up the producer or the others")
        void stalledSubscriberDoesNotBlockOthers() throws Exception {
            EventSubscription<String> stalled = broadcaster.subscribe();
            EventSubscription<String> active = broadcaster.subscribe();

            ExecutorService producer = Executors.newSingleThreadExecutor();
            try {
                Future<?> produced = producer.submit(() -> {
                    for (int i = 0; i < 10_000; i++) {
                        broadcaster.broadcast("e" + i);
                    }
                });
                produced.get(5, TimeUnit.SECONDS);
            } finally {
                producer.shutdownNow();
            }

            assertThat(active.poll(WAIT)).contains("e0");
            assertThat(stalled.getPendingCount()).isEqualTo(10_000);

            // The stalled subscriber still gets everything once it starts reading
            for (int i = 0; i < 10_000; i++) {
                assertThat(stalled.take()).isEqualTo("e" + i);
            }
        }

        @Test
        @DisplayName("Subscriber added later only sees later events")
        void lateSubscriberSeesOnlyLaterEvents() throws Exception {
            broadcaster.broadcast("before");
            EventSubscription<String> late = broadcaster.subscribe();
            broadcaster.broadcast("after");

            assertThat(late.take()).isEqualTo("after");
            assertThat(late.poll(Duration.ofMillis(50))).isEmpty();
        }

        @Test
        @DisplayName("Concurrent subscribes during broadcasting are safe")
        void concurrentSubscribeDuringBroadcast() throws Exception {
            ExecutorService pool = Executors.newFixedThreadPool(4);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<EventSubscription<String>>> subscribed = new ArrayList<>();
            try {
                for (int i = 0; i < 50; i++) {
                    subscribed.add(pool.submit(() -> {
                        start.await();
                        return broadcaster.subscribe();
                    }));
                }
                Future<?> producing = pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 1000; i++) {
                        broadcaster.broadcast("x");
                    }
                    return null;
                });
                start.countDown();
                producing.get(5, TimeUnit.SECONDS);
                for (Future<EventSubscription<String>> future : subscribed) {
                    future.get(5, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(broadcaster.getSubscriberCount()).isEqualTo(50);
        }
    }

    @Nested
    @DisplayName("Unsubscribe Tests")
    class UnsubscribeTests {

        @Test
        @DisplayName("Once a read reports the close, no event follows it, even with a concurrent producer")
        void noEventAfterCloseUnderConcurrentBroadcast() throws Exception {
            ExecutorService producer = Executors.newSingleThreadExecutor();
            try {
                for (int round = 0; round < 200; round++) {
                    EventSubscription<String> subscription = broadcaster.subscribe();
                    CountDownLatch started = new CountDownLatch(1);
                    Future<?> broadcasting = producer.submit(() -> {
                        started.countDown();
                        for (int i = 0; i < 50; i++) {
                            broadcaster.broadcast("e" + i);
                        }
                    });
                    started.await();
                    subscription.close();
                    broadcasting.get(5, TimeUnit.SECONDS);

                    drainUntilClosed(subscription);
                    assertThatThrownBy(() -> subscription.poll(Duration.ZERO))
                            .isInstanceOf(SubscriptionClosedException.class);
                }
            } finally {
                producer.shutdownNow();
            }
        }

        @Test
        @DisplayName("Closing a subscription removes it from the broadcaster")
        void closeRemovesSubscriber() {
            EventSubscription<String> subscription = broadcaster.subscribe();
            broadcaster.subscribe();

            subscription.close();

            assertThat(subscription.isClosed()).isTrue();
            assertThat(broadcaster.getSubscriberCount()).isEqualTo(1);
            assertThat(broadcaster.broadcast("ignored")).isEqualTo(1);
        }

        @Test
        @DisplayName("Buffered events are still readable after close, then reads fail")
        void bufferedEventsSurviveClose() throws Exception {
            EventSubscription<String> subscription = broadcaster.subscribe();
            broadcaster.broadcast("a");
            broadcaster.broadcast("b");

            subscription.close();

            assertThat(subscription.take()).isEqualTo("a");
            assertThat(subscription.poll(WAIT)).contains("b");
            assertThatThrownBy(subscription::take).isInstanceOf(SubscriptionClosedException.class);
            assertThatThrownBy(subscription::take).isInstanceOf(SubscriptionClosedException.class);
        }

        @Test
        @DisplayName("A blocked reader wakes up when the subscription is closed")
        void blockedReaderWakesOnClose() throws Exception {
            EventSubscription<String> subscription = broadcaster.subscribe();
            ExecutorService reader = Executors.newSingleThreadExecutor();
            try {
                Future<Throwable> outcome = reader.submit(() -> {
                    try {
                        subscription.take();
                        return null;
                    } catch (SubscriptionClosedException e) {
                        return e;
                    }
                });

                Thread.sleep(50);
                subscription.close();

                assertThat(outcome.get(2, TimeUnit.SECONDS)).isInstanceOf(SubscriptionClosedException.class);
            } finally {
                reader.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Backlog Limit Tests")
    class BacklogLimitTests {

        @Test
        @DisplayName("Subscriber over the backlog limit is evicted, others keep receiving")
        void slowSubscriberIsEvicted() throws Exception {
            StatusBroadcaster<String> bounded = new StatusBroadcaster<>("bounded", 2, meterRegistry);
            EventSubscription<String> slow = bounded.subscribe();
            EventSubscription<String> fast = bounded.subscribe();

            bounded.broadcast("1");
            assertThat(fast.take()).isEqualTo("1");
            bounded.broadcast("2");
            assertThat(fast.take()).isEqualTo("2");
            bounded.broadcast("3");
            assertThat(fast.take()).isEqualTo("3");

            assertThat(slow.isClosed()).isTrue();
            assertThat(bounded.getSubscriberCount()).isEqualTo(1);
            assertThat(meterRegistry.counter("lightning.subscribers.evicted", "stream", "bounded").count())
                    .isEqualTo(1.0);

            assertThat(slow.take()).isEqualTo("1");
            assertThat(slow.take()).isEqualTo("2");
            assertThatThrownBy(slow::take)
                    .isInstanceOf(SubscriptionClosedException.class)
                    .hasMessageContaining("evicted");
        }
    }

    @Test
    @DisplayName("Active subscriber gauge follows subscribe and close")
    void gaugeTracksSubscribers() {
        EventSubscription<String> first = broadcaster.subscribe();
        broadcaster.subscribe();

        assertThat(meterRegistry.get("lightning.subscribers.active").tag("stream", "test").gauge().value())
                .isEqualTo(2.0);

        first.close();

        assertThat(meterRegistry.get("lightning.subscribers.active").tag("stream", "test").gauge().value())
                .isEqualTo(1.0);
    }

    private static void drainUntilClosed(EventSubscription<String> subscription) throws InterruptedException {
        while (true) {
            try {
                subscription.take();
            } catch (SubscriptionClosedException e) {
                return;
            }
        }
    }
}
