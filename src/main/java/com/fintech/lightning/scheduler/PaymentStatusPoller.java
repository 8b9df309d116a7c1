package com.fintech.lightning.scheduler;

import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.Status;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.node.NodeClient;
import com.fintech.lightning.node.dto.ListPaymentsRequest;
import com.fintech.lightning.node.dto.ListPaymentsResponse;
import com.fintech.lightning.node.dto.NodePayment;
import com.fintech.lightning.service.NodeCallExecutor;
import com.fintech.lightning.service.PaymentStatusTranslator;
import com.fintech.lightning.service.StatusBroadcaster;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Turns the node's payment listing into a stream of payment status updates.
 * <p>
 * The node has no payment subscription, so every tick lists the payments after the
 * checkpoint (in-flight ones included) and broadcasts their status. The checkpoint then
 * moves to the node's {@code lastIndexOffset}, but never past the earliest payment the
 * node has not finished with, so that payment is listed again until it settles or fails.
 * <p>
 * Payments listed again are only re-broadcast when their status changed, which keeps a
 * quiet node from producing events. After a restart the window is empty and recent
 * updates can be delivered a second time.
 * <p>
 * Uses fixedDelay so the next tick doesn't start until the previous one completes.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "lightning.payments.poller.enabled", havingValue = "true", matchIfMissing = true)
public class PaymentStatusPoller {

    private final NodeClient nodeClient;
    private final NodeCallExecutor nodeCalls;
    private final PaymentStatusTranslator translator;
    private final StatusBroadcaster<PaymentStatus> paymentBroadcaster;
    private final MeterRegistry meterRegistry;

    @Value("${lightning.payments.poll-batch-size:0}")
    private long batchSize;

    // Owned by the polling thread; volatile for the health endpoint
    private volatile long checkpoint;
    private volatile boolean checkpointInitialized = false;

    // Last status broadcast per payment index after the checkpoint
    private final Map<Long, Status> window = new HashMap<>();

    // Prevents overlapping polls
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    private Counter polledCounter;
    private Counter broadcastCounter;
    private Counter pollErrorCounter;
    private Timer pollTimer;

    public PaymentStatusPoller(NodeClient nodeClient,
                               NodeCallExecutor nodeCalls,
                               PaymentStatusTranslator translator,
                               @Qualifier("paymentBroadcaster") StatusBroadcaster<PaymentStatus> paymentBroadcaster,
                               MeterRegistry meterRegistry) {
        this.nodeClient = nodeClient;
        this.nodeCalls = nodeCalls;
        this.translator = translator;
        this.paymentBroadcaster = paymentBroadcaster;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        polledCounter = Counter.builder("lightning.payments.polled")
                .description("Payment records returned by polling")
                .register(meterRegistry);

        broadcastCounter = Counter.builder("lightning.payments.broadcast")
                .description("Payment status updates handed to subscribers")
                .register(meterRegistry);

        pollErrorCounter = Counter.builder("lightning.payments.poll.errors")
                .description("Failed payment listing calls")
                .register(meterRegistry);

        pollTimer = Timer.builder("lightning.payments.poll.duration")
                .description("Time taken by one payment polling tick")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${lightning.payments.poll-interval-ms:3000}",
            initialDelayString = "${lightning.payments.poll-interval-ms:3000}")
    public void runScheduledPoll() {
        try {
            poll();
        } catch (Exception e) {
            log.error("Payment poll failed with unexpected error", e);
        }
    }

    /**
     * One polling tick.
     *
     * @return number of status updates broadcast
     */
    public int poll() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Payment poll already in progress, skipping this tick");
            return 0;
        }

        try {
            return pollTimer.record(() -> {
                if (!checkpointInitialized && !initCheckpoint()) {
                    return 0;
                }
                return pollAfterCheckpoint();
            });
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Starts after the most recent completed payment, or from the beginning if there is none.
     *
     * @return false if the node could not be asked; the next tick tries again
     */
    private boolean initCheckpoint() {
        ListPaymentsRequest request = ListPaymentsRequest.builder()
                .includeIncomplete(false)
                .indexOffset(0)
                .maxPayments(1)
                .reversed(true)
                .build();
        try {
            List<NodePayment> latest = nodeCalls.call("ListPayments", () -> nodeClient.listPayments(request)).getPayments();
            checkpoint = latest.isEmpty() ? 0 : latest.get(latest.size() - 1).getPaymentIndex();
            checkpointInitialized = true;
            log.info("Payment polling starts after index {}", PaymentStatusTranslator.toCheckingId(checkpoint));
            return true;
        } catch (NodeClientException e) {
            log.warn("Could not determine latest payment, retrying next tick: {}", e.getMessage());
            pollErrorCounter.increment();
            return false;
        }
    }

    /**
     * Lists everything after the checkpoint. With a page size set, full pages are followed
     * by further pages in the same tick, so a payment stuck in flight near the checkpoint
     * does not hide the payments behind it.
     */
    private int pollAfterCheckpoint() {
        long cursor = checkpoint;
        long earliestInProgress = 0;
        int broadcast = 0;

        while (true) {
            ListPaymentsResponse response = listAfter(cursor);
            if (response == null) {
                break;
            }

            List<NodePayment> payments = response.getPayments();
            if (payments.isEmpty()) {
                log.debug("No payments after index {}", PaymentStatusTranslator.toCheckingId(cursor));
                break;
            }
            polledCounter.increment(payments.size());

            for (NodePayment payment : payments) {
                if (earliestInProgress == 0 && payment.getStatus() != null && payment.getStatus().isInProgress()) {
                    earliestInProgress = payment.getPaymentIndex();
                }
                if (broadcastIfChanged(payment)) {
                    broadcast++;
                }
            }

            long last = response.getLastIndexOffset();
            boolean fullPage = batchSize > 0 && payments.size() >= batchSize;
            if (Long.compareUnsigned(last, cursor) <= 0) {
                break;
            }
            cursor = last;
            if (!fullPage) {
                break;
            }
        }
        broadcastCounter.increment(broadcast);

        long next = cursor;
        if (earliestInProgress != 0 && Long.compareUnsigned(earliestInProgress - 1, next) < 0) {
            next = earliestInProgress - 1;
        }
        advanceCheckpoint(next);

        return broadcast;
    }

    /**
     * @return the page, or null if the node could not be asked
     */
    private ListPaymentsResponse listAfter(long offset) {
        ListPaymentsRequest request = ListPaymentsRequest.builder()
                .includeIncomplete(true)
                .indexOffset(offset)
                .maxPayments(batchSize)
                .reversed(false)
                .build();
        try {
            return nodeCalls.call("ListPayments", () -> nodeClient.listPayments(request));
        } catch (NodeClientException e) {
            log.warn("Error getting payments after index {}: {}", PaymentStatusTranslator.toCheckingId(offset), e.getMessage());
            pollErrorCounter.increment();
            return null;
        }
    }

    private boolean broadcastIfChanged(NodePayment payment) {
        PaymentStatus status = translator.translate(payment);
        Status previous = window.put(payment.getPaymentIndex(), status.getStatus());
        if (previous == status.getStatus()) {
            return false;
        }

        int subscribers = paymentBroadcaster.broadcast(status);
        log.debug("Payment {} is {} ({} subscribers)", status.getCheckingID(), status.getStatus(), subscribers);
        return true;
    }

    private void advanceCheckpoint(long next) {
        if (next != checkpoint) {
            log.debug("Payment checkpoint {} -> {}",
                    PaymentStatusTranslator.toCheckingId(checkpoint), PaymentStatusTranslator.toCheckingId(next));
        }
        checkpoint = next;
        window.keySet().removeIf(index -> Long.compareUnsigned(index, next) <= 0);
    }

    public long getCheckpoint() {
        return checkpoint;
    }

    public boolean isCheckpointInitialized() {
        return checkpointInitialized;
    }
}
