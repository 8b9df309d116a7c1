package com.fintech.lightning.node;

import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.node.dto.AddInvoiceRequest;
import com.fintech.lightning.node.dto.AddInvoiceResponse;
import com.fintech.lightning.node.dto.HtlcAttempt;
import com.fintech.lightning.node.dto.InvoiceState;
import com.fintech.lightning.node.dto.ListPaymentsRequest;
import com.fintech.lightning.node.dto.ListPaymentsResponse;
import com.fintech.lightning.node.dto.NodeInvoice;
import com.fintech.lightning.node.dto.NodePayment;
import com.fintech.lightning.node.dto.NodePaymentStatus;
import com.fintech.lightning.node.dto.SendPaymentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.stream.IntStream;

/**
 * Simulated Lightning node.
 * <p>
 * Keeps invoices and payments in memory and mimics the parts of LND's behaviour the
 * adapter relies on:
 * - invoice events for every state change (creation included), not only settlements
 * - a send stream whose first message carries the freshly assigned payment index
 * - index-offset paging of the payment database with a "last index offset" cursor
 * <p>
 * Settlement, payment outcomes, outages and stream failures are driven through the
 * simulation methods at the bottom of this class.
 */
@Service
@Slf4j
@ConditionalOnProperty(name = "lightning.node.mock.enabled", havingValue = "true", matchIfMissing = true)
public class InMemoryLightningNode implements NodeClient {

    private static final String NODE_NAME = "InMemoryNode";
    private static final HexFormat HEX = HexFormat.of();

    private final Map<String, NodeInvoice> invoices = new ConcurrentHashMap<>();
    private final NavigableMap<Long, NodePayment> payments = new ConcurrentSkipListMap<>();
    private final List<QueueNodeStream<NodeInvoice>> invoiceStreams = new CopyOnWriteArrayList<>();

    private final AtomicLong addIndex = new AtomicLong();
    private final AtomicLong settleIndex = new AtomicLong();
    private final AtomicLong paymentIndex = new AtomicLong();
    private final AtomicLong balanceSat;

    private final SecureRandom random = new SecureRandom();

    @Value("${lightning.node.mock.latency-ms:0}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    public InMemoryLightningNode(@Value("${lightning.node.mock.initial-balance-sat:1000000}") long initialBalanceSat) {
        this.balanceSat = new AtomicLong(initialBalanceSat);
        log.info("In-memory Lightning node initialized with local balance {} sat", initialBalanceSat);
    }

    @Override
    public long channelBalance() {
        enter("ChannelBalance");
        return balanceSat.get();
    }

    @Override
    public AddInvoiceResponse addInvoice(AddInvoiceRequest request) {
        enter("AddInvoice");
        if (request.getValueMsat() < 0) {
            throw new NodeClientException("amount must not be negative", "AddInvoice", false);
        }

        byte[] preimage = new byte[32];
        random.nextBytes(preimage);
        byte[] hash = sha256(preimage);
        String paymentRequest = "lnsim" + request.getValueMsat() + "n1" + HEX.formatHex(hash);

        NodeInvoice invoice = NodeInvoice.builder()
                .rHash(hash)
                .rPreimage(preimage)
                .paymentRequest(paymentRequest)
                .memo(request.getMemo())
                .valueMsat(request.getValueMsat())
                .state(InvoiceState.OPEN)
                .amtPaidMsat(0)
                .addIndex(addIndex.incrementAndGet())
                .build();
        invoices.put(HEX.formatHex(hash), invoice);
        publishInvoiceEvent(invoice);

        log.debug("Created invoice {} for {} msat", HEX.formatHex(hash), request.getValueMsat());

        return AddInvoiceResponse.builder()
                .rHash(hash)
                .paymentRequest(paymentRequest)
                .addIndex(invoice.getAddIndex())
                .build();
    }

    @Override
    public Optional<NodeInvoice> lookupInvoice(byte[] rHash) {
        enter("LookupInvoice");
        return Optional.ofNullable(invoices.get(HEX.formatHex(rHash)));
    }

    @Override
    public NodeStream<NodeInvoice> subscribeInvoices() {
        enter("SubscribeInvoices");
        QueueNodeStream<NodeInvoice> stream = new QueueNodeStream<>(invoiceStreams::remove);
        invoiceStreams.add(stream);
        log.debug("Opened invoice subscription, {} active", invoiceStreams.size());
        return stream;
    }

    @Override
    public NodeStream<NodePayment> sendPayment(SendPaymentRequest request) {
        enter("SendPaymentV2");
        if (request.getPaymentRequest() == null || request.getPaymentRequest().isBlank()) {
            throw new NodeClientException("invalid payment request", "SendPaymentV2", false);
        }

        long amount = request.getAmtMsat() != 0 ? request.getAmtMsat() : encodedAmount(request.getPaymentRequest());
        NodePayment payment = NodePayment.builder()
                .paymentHash(HEX.formatHex(sha256(request.getPaymentRequest().getBytes())))
                .paymentIndex(paymentIndex.incrementAndGet())
                .status(NodePaymentStatus.IN_FLIGHT)
                .valueMsat(amount)
                .feeMsat(0)
                .paymentPreimage("")
                .htlcs(List.of(HtlcAttempt.builder().attemptId(1).status(HtlcAttempt.Status.IN_FLIGHT).build()))
                .build();
        payments.put(payment.getPaymentIndex(), payment);

        log.debug("Payment {} in flight for {} msat", payment.getPaymentIndex(), amount);

        QueueNodeStream<NodePayment> stream = new QueueNodeStream<>(s -> { });
        stream.push(payment);
        return stream;
    }

    @Override
    public ListPaymentsResponse listPayments(ListPaymentsRequest request) {
        enter("ListPayments");

        Iterable<NodePayment> candidates = request.isReversed()
                ? (request.getIndexOffset() == 0 ? payments.descendingMap() : payments.headMap(request.getIndexOffset(), false).descendingMap()).values()
                : payments.tailMap(request.getIndexOffset(), false).values();

        List<NodePayment> page = new ArrayList<>();
        for (NodePayment payment : candidates) {
            if (!request.isIncludeIncomplete() && payment.getStatus() != NodePaymentStatus.SUCCEEDED) {
                continue;
            }
            page.add(payment);
            if (request.getMaxPayments() > 0 && page.size() >= request.getMaxPayments()) {
                break;
            }
        }
        if (request.isReversed()) {
            Collections.reverse(page);
        }

        if (page.isEmpty()) {
            return ListPaymentsResponse.builder().build();
        }
        return ListPaymentsResponse.builder()
                .payments(List.copyOf(page))
                .firstIndexOffset(page.get(0).getPaymentIndex())
                .lastIndexOffset(page.get(page.size() - 1).getPaymentIndex())
                .build();
    }

    @Override
    public String getNodeName() {
        return NODE_NAME;
    }

    private void enter(String operation) {
        simulateLatency();
        if (simulateOutage) {
            throw new NodeClientException("Lightning node is currently unreachable", operation);
        }
    }

    private void publishInvoiceEvent(NodeInvoice invoice) {
        for (QueueNodeStream<NodeInvoice> stream : invoiceStreams) {
            stream.push(invoice);
        }
    }

    private static long encodedAmount(String paymentRequest) {
        if (paymentRequest.startsWith("lnsim")) {
            int end = paymentRequest.indexOf("n1");
            if (end > 5) {
                try {
                    return Long.parseLong(paymentRequest.substring(5, end));
                } catch (NumberFormatException e) {
                    log.debug("Payment request {} carries no parsable amount", paymentRequest);
                }
            }
        }
        return 0;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    // Methods for testing/simulation control

    /**
     * Marks an invoice as paid and emits the settlement on every open invoice stream.
     *
     * @return false if the hash is unknown
     */
    public boolean settleInvoice(String hexHash, long amtPaidMsat) {
        NodeInvoice existing = invoices.get(hexHash);
        if (existing == null) {
            return false;
        }
        NodeInvoice settled = existing.toBuilder()
                .state(InvoiceState.SETTLED)
                .amtPaidMsat(amtPaidMsat)
                .settleIndex(settleIndex.incrementAndGet())
                .build();
        invoices.put(hexHash, settled);
        balanceSat.addAndGet(amtPaidMsat / 1000);
        publishInvoiceEvent(settled);
        log.info("Invoice {} settled for {} msat", hexHash, amtPaidMsat);
        return true;
    }

    /**
     * Emits an invoice event without touching stored state.
     */
    public void emitInvoiceEvent(NodeInvoice event) {
        publishInvoiceEvent(event);
    }

    /**
     * Makes every open invoice stream report one read error.
     */
    public void failInvoiceStreams(String message) {
        for (QueueNodeStream<NodeInvoice> stream : invoiceStreams) {
            stream.pushError(new NodeClientException(message, "SubscribeInvoices"));
        }
    }

    /**
     * Ends every open invoice stream, as a node shutting down would.
     */
    public void endInvoiceStreams() {
        for (QueueNodeStream<NodeInvoice> stream : invoiceStreams) {
            stream.end();
        }
        invoiceStreams.clear();
    }

    public void completePayment(long index, long feeMsat) {
        payments.computeIfPresent(index, (i, payment) -> {
            byte[] preimage = new byte[32];
            random.nextBytes(preimage);
            balanceSat.addAndGet(-(payment.getValueMsat() + feeMsat) / 1000);
            return payment.toBuilder()
                    .status(NodePaymentStatus.SUCCEEDED)
                    .feeMsat(feeMsat)
                    .paymentPreimage(HEX.formatHex(preimage))
                    .htlcs(List.of(HtlcAttempt.builder().attemptId(1).status(HtlcAttempt.Status.SUCCEEDED).build()))
                    .build();
        });
    }

    /**
     * @param attempts number of failed HTLC attempts to record; zero models a payment
     *                 that never left the node (e.g. no route)
     */
    public void failPayment(long index, int attempts) {
        payments.computeIfPresent(index, (i, payment) -> payment.toBuilder()
                .status(NodePaymentStatus.FAILED)
                .htlcs(IntStream.rangeClosed(1, attempts)
                        .mapToObj(n -> HtlcAttempt.builder().attemptId(n).status(HtlcAttempt.Status.FAILED).build())
                        .toList())
                .build());
    }

    /**
     * Writes a payment record directly, bypassing the send flow.
     */
    public void putPayment(NodePayment payment) {
        payments.put(payment.getPaymentIndex(), payment);
        paymentIndex.accumulateAndGet(payment.getPaymentIndex(), Math::max);
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Node outage simulation set to: {}", outage);
    }

    public int getOpenInvoiceStreams() {
        return invoiceStreams.size();
    }

    /**
     * Clear all simulated state.
     */
    public void clearMockData() {
        invoices.clear();
        payments.clear();
        paymentIndex.set(0);
    }

    /**
     * Stream fed from an in-memory queue.
     */
    static final class QueueNodeStream<T> implements NodeStream<T> {

        private final BlockingQueue<Signal<T>> queue = new LinkedBlockingQueue<>();
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final Consumer<QueueNodeStream<T>> onClose;

        QueueNodeStream(Consumer<QueueNodeStream<T>> onClose) {
            this.onClose = onClose;
        }

        void push(T message) {
            queue.add(new Signal<>(message, null));
        }

        void pushError(NodeClientException error) {
            queue.add(new Signal<>(null, error));
        }

        void end() {
            queue.add(new Signal<>(null, null));
        }

        @Override
        public Optional<T> receive() {
            if (closed.get() && queue.isEmpty()) {
                return Optional.empty();
            }
            Signal<T> signal;
            try {
                signal = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NodeClientException("interrupted while waiting for stream message", "Recv", e);
            }
            if (signal.error != null) {
                throw signal.error;
            }
            return Optional.ofNullable(signal.message);
        }

        @Override
        public void close() {
            if (closed.compareAndSet(false, true)) {
                end();
                onClose.accept(this);
            }
        }

        private static final class Signal<T> {
            private final T message;
            private final NodeClientException error;

            Signal(T message, NodeClientException error) {
                this.message = message;
                this.error = error;
            }
        }
    }
}
