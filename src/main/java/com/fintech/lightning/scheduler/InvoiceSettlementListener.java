package com.fintech.lightning.scheduler;

import com.fintech.lightning.dto.InvoiceStatus;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.node.NodeClient;
import com.fintech.lightning.node.NodeStream;
import com.fintech.lightning.node.dto.InvoiceState;
import com.fintech.lightning.node.dto.NodeInvoice;
import com.fintech.lightning.service.NodeCallExecutor;
import com.fintech.lightning.service.StatusBroadcaster;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.HexFormat;
import java.util.Optional;

/**
 * Relays settlements from the node's invoice subscription to invoice subscribers.
 * <p>
 * One node subscription per application, read on a dedicated thread. Events for invoices
 * that are not settled are dropped. Read errors are logged and reading continues.
 * <p>
 * If the node ends the stream, or the subscription cannot be opened, the listener stops
 * for good: it is not resubscribed. The failure is logged, reported by the health endpoint
 * and published as an {@link InvoiceStreamTerminatedEvent}.
 */
@Component
@Slf4j
@ConditionalOnProperty(name = "lightning.invoices.listener.enabled", havingValue = "true", matchIfMissing = true)
public class InvoiceSettlementListener {

    public enum State {
        NOT_STARTED,
        RUNNING,
        TERMINATED,
        STOPPED
    }

    private static final HexFormat HEX = HexFormat.of();

    private final NodeClient nodeClient;
    private final NodeCallExecutor nodeCalls;
    private final StatusBroadcaster<InvoiceStatus> invoiceBroadcaster;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;

    private volatile State state = State.NOT_STARTED;
    private volatile String terminationReason;
    private volatile boolean stopping = false;
    private volatile NodeStream<NodeInvoice> stream;
    private Thread worker;

    private Counter settledCounter;
    private Counter readErrorCounter;

    public InvoiceSettlementListener(NodeClient nodeClient,
                                     NodeCallExecutor nodeCalls,
                                     @Qualifier("invoiceBroadcaster") StatusBroadcaster<InvoiceStatus> invoiceBroadcaster,
                                     ApplicationEventPublisher eventPublisher,
                                     MeterRegistry meterRegistry) {
        this.nodeClient = nodeClient;
        this.nodeCalls = nodeCalls;
        this.invoiceBroadcaster = invoiceBroadcaster;
        this.eventPublisher = eventPublisher;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        settledCounter = Counter.builder("lightning.invoices.settled")
                .description("Settlements relayed to invoice subscribers")
                .register(meterRegistry);

        readErrorCounter = Counter.builder("lightning.invoices.stream.errors")
                .description("Read errors on the node invoice subscription")
                .register(meterRegistry);
    }

    @EventListener(ApplicationReadyEvent.class)
    public synchronized void start() {
        if (state != State.NOT_STARTED) {
            return;
        }
        worker = new Thread(this::run, "invoice-settlement-listener");
        worker.setDaemon(true);
        worker.start();
    }

    void run() {
        try {
            stream = nodeCalls.call("SubscribeInvoices", nodeClient::subscribeInvoices);
        } catch (NodeClientException e) {
            terminate("failed to subscribe to invoices: " + e.getMessage(), e);
            return;
        }

        state = State.RUNNING;
        log.info("Listening for invoice settlements from {}", nodeClient.getNodeName());

        try (NodeStream<NodeInvoice> invoices = stream) {
            while (!stopping) {
                Optional<NodeInvoice> event;
                try {
                    event = invoices.receive();
                } catch (NodeClientException e) {
                    if (stopping) {
                        break;
                    }
                    if (e.getCause() instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                        // Every further read would fail at once
                        log.warn("Invoice listener interrupted, stopping");
                        state = State.STOPPED;
                        break;
                    }
                    log.error("Error receiving invoice event: {}", e.getMessage());
                    readErrorCounter.increment();
                    continue;
                }

                if (event.isEmpty()) {
                    if (!stopping) {
                        terminate("invoice stream ended by node", null);
                    }
                    return;
                }
                handle(event.get());
            }
        }
    }

    /**
     * @return true if the event was a settlement and was broadcast
     */
    boolean handle(NodeInvoice event) {
        if (event.getState() != InvoiceState.SETTLED) {
            log.debug("Ignoring invoice event in state {}", event.getState());
            return false;
        }

        InvoiceStatus status = InvoiceStatus.settled(HEX.formatHex(event.getRHash()), event.getAmtPaidMsat());
        int subscribers = invoiceBroadcaster.broadcast(status);
        settledCounter.increment();

        log.info("Invoice {} settled for {} msat, notified {} subscribers",
                status.getCheckingID(), status.getMsatoshiReceived(), subscribers);
        return true;
    }

    private void terminate(String reason, Throwable cause) {
        state = State.TERMINATED;
        terminationReason = reason;
        if (cause != null) {
            log.error("Invoice settlement stream terminated: {}. Settlements are no longer delivered until restart", reason, cause);
        } else {
            log.error("Invoice settlement stream terminated: {}. Settlements are no longer delivered until restart", reason);
        }
        eventPublisher.publishEvent(new InvoiceStreamTerminatedEvent(this, reason));
    }

    @PreDestroy
    public synchronized void stop() {
        stopping = true;
        if (state == State.RUNNING) {
            state = State.STOPPED;
        }
        NodeStream<NodeInvoice> current = stream;
        if (current != null) {
            current.close();
        }
        if (worker != null) {
            worker.interrupt();
        }
    }

    public State getState() {
        return state;
    }

    public String getTerminationReason() {
        return terminationReason;
    }
}
