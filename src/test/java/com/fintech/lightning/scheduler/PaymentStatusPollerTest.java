package com.fintech.lightning.scheduler;

import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.Status;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.node.NodeClient;
import com.fintech.lightning.node.dto.ListPaymentsRequest;
import com.fintech.lightning.node.dto.ListPaymentsResponse;
import com.fintech.lightning.node.dto.NodePayment;
import com.fintech.lightning.node.dto.NodePaymentStatus;
import com.fintech.lightning.service.EventSubscription;
import com.fintech.lightning.service.NodeCallExecutor;
import com.fintech.lightning.service.PaymentStatusTranslator;
import com.fintech.lightning.service.StatusBroadcaster;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PaymentStatusPoller.
 * <p>
 * The node client answers from an in-test payment table using the node's
 * paging rules, so the checkpoint arithmetic is exercised for real.
 */
@ExtendWith(MockitoExtension.class)
class PaymentStatusPollerTest {

    @Mock
    private NodeClient nodeClient;

    private final TreeMap<Long, NodePayment> payments = new TreeMap<>();
    private int failingCalls;

    private SimpleMeterRegistry meterRegistry;
    private StatusBroadcaster<PaymentStatus> broadcaster;
    private PaymentStatusPoller poller;
    private EventSubscription<PaymentStatus> subscriber;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        broadcaster = new StatusBroadcaster<>("payments", 0, meterRegistry);
        NodeCallExecutor nodeCalls = new NodeCallExecutor(
                CircuitBreakerRegistry.ofDefaults(), TimeLimiterRegistry.ofDefaults(), 0);

        poller = new PaymentStatusPoller(nodeClient, nodeCalls, new PaymentStatusTranslator(), broadcaster, meterRegistry);
        poller.initMetrics();

        when(nodeClient.listPayments(any(ListPaymentsRequest.class))).thenAnswer(invocation -> {
            if (failingCalls > 0) {
                failingCalls--;
                throw new NodeClientException("connection reset", "ListPayments");
            }
            return page(invocation.getArgument(0));
        });

        subscriber = broadcaster.subscribe();
    }

    @Test
    @DisplayName("Should start after the latest completed payment")
    void shouldStartAfterLatestCompletedPayment() throws Exception {
        addPayment(1, NodePaymentStatus.SUCCEEDED);
        addPayment(2, NodePaymentStatus.SUCCEEDED);

        int broadcast = poller.poll();

        assertThat(poller.isCheckpointInitialized()).isTrue();
        assertThat(poller.getCheckpoint()).isEqualTo(2);
        assertThat(broadcast).isZero();
        assertThat(drain()).isEmpty();
    }

    @Test
    @DisplayName("Should start from the beginning on a node without payments")
    void shouldStartFromZeroOnEmptyNode() {
        int broadcast = poller.poll();

        assertThat(poller.isCheckpointInitialized()).isTrue();
        assertThat(poller.getCheckpoint()).isZero();
        assertThat(broadcast).isZero();
    }

    @Test
    @DisplayName("Should broadcast payments made after the checkpoint")
    void shouldBroadcastNewPayments() throws Exception {
        addPayment(1, NodePaymentStatus.SUCCEEDED);
        poller.poll();

        payments.put(2L, NodePayment.builder()
                .paymentIndex(2)
                .status(NodePaymentStatus.SUCCEEDED)
                .feeMsat(3)
                .paymentPreimage("aa")
                .build());
        int broadcast = poller.poll();

        assertThat(broadcast).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isEqualTo(2);

        List<PaymentStatus> received = drain();
        assertThat(received).hasSize(1);
        assertThat(received.get(0).getCheckingID()).isEqualTo("2");
        assertThat(received.get(0).getStatus()).isEqualTo(Status.COMPLETE);
        assertThat(received.get(0).getFeePaid()).isEqualTo(3);
        assertThat(received.get(0).getPreimage()).isEqualTo("aa");
    }

    @Test
    @DisplayName("Polling an unchanged node twice broadcasts nothing the second time")
    void shouldNotRebroadcastUnchangedNode() throws Exception {
        poller.poll();
        addPayment(1, NodePaymentStatus.SUCCEEDED);
        addPayment(2, NodePaymentStatus.FAILED);

        assertThat(poller.poll()).isEqualTo(2);
        assertThat(drain()).hasSize(2);

        assertThat(poller.poll()).isZero();
        assertThat(drain()).isEmpty();
    }

    @Test
    @DisplayName("In-flight payment is tracked until it completes")
    void shouldFollowInFlightPaymentToCompletion() throws Exception {
        addPayment(1, NodePaymentStatus.IN_FLIGHT);

        assertThat(poller.poll()).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isZero();

        // Still in flight: listed again but not re-broadcast
        assertThat(poller.poll()).isZero();

        payments.put(1L, payments.get(1L).toBuilder()
                .status(NodePaymentStatus.SUCCEEDED)
                .feeMsat(5)
                .build());
        assertThat(poller.poll()).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isEqualTo(1);

        List<PaymentStatus> received = drain();
        assertThat(received).extracting(PaymentStatus::getStatus)
                .containsExactly(Status.PENDING, Status.COMPLETE);
        assertThat(received.get(1).getFeePaid()).isEqualTo(5);
    }

    @Test
    @DisplayName("Checkpoint stops before the earliest in-flight payment")
    void shouldHoldCheckpointBeforeEarliestInFlight() {
        poller.poll();
        addPayment(1, NodePaymentStatus.SUCCEEDED);
        addPayment(2, NodePaymentStatus.IN_FLIGHT);
        addPayment(3, NodePaymentStatus.SUCCEEDED);
        addPayment(4, NodePaymentStatus.IN_FLIGHT);

        assertThat(poller.poll()).isEqualTo(4);
        assertThat(poller.getCheckpoint()).isEqualTo(1);
    }

    @Test
    @DisplayName("Checkpoint advances to the node's last index offset")
    void shouldAdvanceToLastIndexOffset() {
        poller.poll();
        addPayment(1, NodePaymentStatus.SUCCEEDED);
        addPayment(2, NodePaymentStatus.FAILED);
        addPayment(3, NodePaymentStatus.SUCCEEDED);

        poller.poll();

        assertThat(poller.getCheckpoint()).isEqualTo(3);
    }

    @Test
    @DisplayName("Listing error skips the tick and leaves the checkpoint alone")
    void shouldContinueAfterListingError() throws Exception {
        poller.poll();
        addPayment(1, NodePaymentStatus.SUCCEEDED);

        failingCalls = 1;
        assertThat(poller.poll()).isZero();
        assertThat(poller.getCheckpoint()).isZero();
        assertThat(meterRegistry.get("lightning.payments.poll.errors").counter().count()).isEqualTo(1.0);

        assertThat(poller.poll()).isEqualTo(1);
        assertThat(drain()).hasSize(1);
    }

    @Test
    @DisplayName("Checkpoint lookup is retried on the next tick after a failure")
    void shouldRetryCheckpointInitialization() {
        addPayment(4, NodePaymentStatus.SUCCEEDED);
        failingCalls = 1;

        assertThat(poller.poll()).isZero();
        assertThat(poller.isCheckpointInitialized()).isFalse();

        poller.poll();
        assertThat(poller.isCheckpointInitialized()).isTrue();
        assertThat(poller.getCheckpoint()).isEqualTo(4);
    }

    @Test
    @DisplayName("Initiated payment holds the checkpoint until it completes")
    void shouldFollowInitiatedPaymentToCompletion() throws Exception {
        poller.poll();
        addPayment(1, NodePaymentStatus.INITIATED);

        assertThat(poller.poll()).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isZero();

        payments.put(1L, payments.get(1L).toBuilder()
                .status(NodePaymentStatus.SUCCEEDED)
                .feeMsat(2)
                .build());
        assertThat(poller.poll()).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isEqualTo(1);

        assertThat(drain()).extracting(PaymentStatus::getStatus)
                .containsExactly(Status.UNKNOWN, Status.COMPLETE);
    }

    @Test
    @DisplayName("Full pages are followed within one tick")
    void shouldPageThroughBacklogInOneTick() {
        ReflectionTestUtils.setField(poller, "batchSize", 2L);
        poller.poll();
        for (long index = 1; index <= 5; index++) {
            addPayment(index, NodePaymentStatus.SUCCEEDED);
        }

        assertThat(poller.poll()).isEqualTo(5);
        assertThat(poller.getCheckpoint()).isEqualTo(5);
        assertThat(poller.poll()).isZero();
    }

    @Test
    @DisplayName("Payment stuck in flight does not hide later payments")
    void shouldDeliverPaymentsBehindStuckInFlight() throws Exception {
        ReflectionTestUtils.setField(poller, "batchSize", 2L);
        poller.poll();
        addPayment(1, NodePaymentStatus.IN_FLIGHT);
        for (long index = 2; index <= 5; index++) {
            addPayment(index, NodePaymentStatus.SUCCEEDED);
        }

        for (int tick = 0; tick < 3; tick++) {
            poller.poll();
        }

        assertThat(poller.getCheckpoint()).isZero();
        assertThat(drain()).extracting(PaymentStatus::getCheckingID)
                .containsExactly("1", "2", "3", "4", "5");

        payments.put(1L, payments.get(1L).toBuilder().status(NodePaymentStatus.SUCCEEDED).build());
        assertThat(poller.poll()).isEqualTo(1);
        assertThat(poller.getCheckpoint()).isEqualTo(5);
        assertThat(drain()).extracting(PaymentStatus::getStatus).containsExactly(Status.COMPLETE);
    }

    private void addPayment(long index, NodePaymentStatus status) {
        payments.put(index, NodePayment.builder()
                .paymentIndex(index)
                .status(status)
                .build());
    }

    private List<PaymentStatus> drain() throws InterruptedException {
        List<PaymentStatus> received = new ArrayList<>();
        Optional<PaymentStatus> next;
        while ((next = subscriber.poll(Duration.ZERO)).isPresent()) {
            received.add(next.get());
        }
        return received;
    }

    /**
     * Pages through the payment table the way the node does: results always come back
     * in ascending index order, reversed paging counts back from the offset.
     */
    private ListPaymentsResponse page(ListPaymentsRequest request) {
        List<NodePayment> matching = payments.values().stream()
                .filter(p -> request.isIncludeIncomplete() || p.getStatus() == NodePaymentStatus.SUCCEEDED)
                .filter(p -> request.isReversed()
                        ? request.getIndexOffset() == 0 || p.getPaymentIndex() < request.getIndexOffset()
                        : p.getPaymentIndex() > request.getIndexOffset())
                .collect(Collectors.toList());

        int max = (int) request.getMaxPayments();
        if (max > 0 && matching.size() > max) {
            matching = request.isReversed()
                    ? matching.subList(matching.size() - max, matching.size())
                    : matching.subList(0, max);
        }
        if (matching.isEmpty()) {
            return ListPaymentsResponse.builder().build();
        }
        return ListPaymentsResponse.builder()
                .payments(List.copyOf(matching))
                .firstIndexOffset(matching.get(0).getPaymentIndex())
                .lastIndexOffset(matching.get(matching.size() - 1).getPaymentIndex())
                .build();
    }
}
