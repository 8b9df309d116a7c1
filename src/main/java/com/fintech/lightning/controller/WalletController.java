package com.fintech.lightning.controller;

import com.fintech.lightning.dto.InvoiceData;
import com.fintech.lightning.dto.InvoiceParams;
import com.fintech.lightning.dto.InvoiceStatus;
import com.fintech.lightning.dto.PaymentData;
import com.fintech.lightning.dto.PaymentParams;
import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.WalletInfo;
import com.fintech.lightning.exception.SubscriptionClosedException;
import com.fintech.lightning.scheduler.InvoiceSettlementListener;
import com.fintech.lightning.scheduler.PaymentStatusPoller;
import com.fintech.lightning.service.EventSubscription;
import com.fintech.lightning.service.NodeCallExecutor;
import com.fintech.lightning.service.StatusBroadcaster;
import com.fintech.lightning.service.Wallet;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API over the wallet.
 * <p>
 * Provides endpoints for:
 * - Balance, invoice and payment operations
 * - Live settlement and payment status streams (Server-Sent Events)
 * - Health of the background listeners
 */
@RestController
@RequestMapping("/api/v1/wallet")
@Slf4j
@Tag(name = "Wallet", description = "Lightning wallet operations API")
public class WalletController {

    private final Wallet wallet;
    private final NodeCallExecutor nodeCalls;
    private final StatusBroadcaster<InvoiceStatus> invoiceBroadcaster;
    private final StatusBroadcaster<PaymentStatus> paymentBroadcaster;
    private final ObjectProvider<PaymentStatusPoller> poller;
    private final ObjectProvider<InvoiceSettlementListener> invoiceListener;
    private final TaskExecutor streamRelayExecutor;

    public WalletController(Wallet wallet,
                            NodeCallExecutor nodeCalls,
                            @Qualifier("invoiceBroadcaster") StatusBroadcaster<InvoiceStatus> invoiceBroadcaster,
                            @Qualifier("paymentBroadcaster") StatusBroadcaster<PaymentStatus> paymentBroadcaster,
                            ObjectProvider<PaymentStatusPoller> poller,
                            ObjectProvider<InvoiceSettlementListener> invoiceListener,
                            @Qualifier("streamRelayExecutor") TaskExecutor streamRelayExecutor) {
        this.wallet = wallet;
        this.nodeCalls = nodeCalls;
        this.invoiceBroadcaster = invoiceBroadcaster;
        this.paymentBroadcaster = paymentBroadcaster;
        this.poller = poller;
        this.invoiceListener = invoiceListener;
        this.streamRelayExecutor = streamRelayExecutor;
    }

    @Operation(summary = "Get wallet info", description = "Returns the node's local channel balance.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Balance retrieved",
                    content = @Content(schema = @Schema(implementation = WalletInfo.class))),
            @ApiResponse(responseCode = "502", description = "Node call failed")
    })
    @GetMapping("/info")
    public ResponseEntity<WalletInfo> getInfo() {
        return ResponseEntity.ok(wallet.getInfo());
    }

    @Operation(
            summary = "Create invoice",
            description = "Creates an invoice on the node. The returned checkingID is the hex payment hash used for status lookups."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Invoice created",
                    content = @Content(schema = @Schema(implementation = InvoiceData.class))),
            @ApiResponse(responseCode = "400", description = "Invalid invoice parameters"),
            @ApiResponse(responseCode = "502", description = "Node call failed")
    })
    @PostMapping("/invoices")
    public ResponseEntity<InvoiceData> createInvoice(@RequestBody InvoiceParams params) {
        return ResponseEntity.ok(wallet.createInvoice(params));
    }

    @Operation(
            summary = "Get invoice status",
            description = "Returns the invoice status. Unknown invoices are reported with exists=false, not as an error."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved",
                    content = @Content(schema = @Schema(implementation = InvoiceStatus.class))),
            @ApiResponse(responseCode = "400", description = "Malformed checking id")
    })
    @GetMapping("/invoices/{checkingId}")
    public ResponseEntity<InvoiceStatus> getInvoiceStatus(
            @Parameter(description = "Hex payment hash") @PathVariable String checkingId) {
        return ResponseEntity.ok(wallet.getInvoiceStatus(checkingId));
    }

    @Operation(
            summary = "Pay invoice",
            description = "Starts a payment and returns as soon as the node has registered it. Track completion via the status endpoint or the payment stream."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment initiated",
                    content = @Content(schema = @Schema(implementation = PaymentData.class))),
            @ApiResponse(responseCode = "400", description = "Invalid payment parameters"),
            @ApiResponse(responseCode = "502", description = "Node call failed")
    })
    @PostMapping("/payments")
    public ResponseEntity<PaymentData> makePayment(@RequestBody PaymentParams params) {
        return ResponseEntity.ok(wallet.makePayment(params));
    }

    @Operation(summary = "Get payment status", description = "Returns the status of an outgoing payment by its checking id (payment index).")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Status retrieved",
                    content = @Content(schema = @Schema(implementation = PaymentStatus.class))),
            @ApiResponse(responseCode = "400", description = "Malformed checking id"),
            @ApiResponse(responseCode = "404", description = "No payment at that index")
    })
    @GetMapping("/payments/{checkingId}")
    public ResponseEntity<PaymentStatus> getPaymentStatus(
            @Parameter(description = "Payment index") @PathVariable String checkingId) {
        return ResponseEntity.ok(wallet.getPaymentStatus(checkingId));
    }

    @Operation(summary = "Stream settled invoices", description = "Server-Sent Events stream of settled invoices, one 'invoice' event per settlement.")
    @GetMapping(path = "/invoices/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamPaidInvoices() {
        return relay(wallet.paidInvoicesStream(), "invoice");
    }

    @Operation(
            summary = "Stream payment updates",
            description = "Server-Sent Events stream of payment status updates. Delivery is at-least-once; deduplicate on checkingID and status."
    )
    @GetMapping(path = "/payments/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamPayments() {
        return relay(wallet.paymentsStream(), "payment");
    }

    @Operation(
            summary = "Health check",
            description = "Reports the background listeners. DOWN (503) once the invoice stream is lost, since settlements are no longer delivered."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Service is healthy"),
            @ApiResponse(responseCode = "503", description = "Invoice stream terminated, restart required")
    })
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        Map<String, Object> invoices = new LinkedHashMap<>();
        invoices.put("subscribers", invoiceBroadcaster.getSubscriberCount());
        InvoiceSettlementListener listener = invoiceListener.getIfAvailable();
        boolean invoiceStreamLost = false;
        if (listener != null) {
            invoices.put("listener", listener.getState());
            invoiceStreamLost = listener.getState() == InvoiceSettlementListener.State.TERMINATED;
            if (invoiceStreamLost) {
                invoices.put("terminationReason", listener.getTerminationReason());
            }
        }

        Map<String, Object> payments = new LinkedHashMap<>();
        payments.put("subscribers", paymentBroadcaster.getSubscriberCount());
        PaymentStatusPoller paymentPoller = poller.getIfAvailable();
        if (paymentPoller != null) {
            payments.put("checkpointInitialized", paymentPoller.isCheckpointInitialized());
            payments.put("checkpoint", Long.toUnsignedString(paymentPoller.getCheckpoint()));
        }

        CircuitBreaker.State circuit = nodeCalls.getCircuitState();

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", invoiceStreamLost ? "DOWN" : "UP");
        health.put("kind", wallet.kind());
        health.put("node", Map.of("circuitBreaker", circuit.name()));
        health.put("invoices", invoices);
        health.put("payments", payments);

        return ResponseEntity.status(invoiceStreamLost ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK).body(health);
    }

    private <T> SseEmitter relay(EventSubscription<T> subscription, String eventName) {
        // No timeout: the stream lives until the client disconnects
        SseEmitter emitter = new SseEmitter(0L);
        emitter.onCompletion(subscription::close);
        emitter.onTimeout(subscription::close);
        emitter.onError(e -> subscription.close());

        try {
            streamRelayExecutor.execute(() -> forward(subscription, emitter, eventName));
        } catch (TaskRejectedException e) {
            subscription.close();
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "too many open streams", e);
        }
        log.debug("Opened {} event stream", subscription.getStream());
        return emitter;
    }

    private <T> void forward(EventSubscription<T> subscription, SseEmitter emitter, String eventName) {
        try {
            while (true) {
                T event = subscription.take();
                emitter.send(SseEmitter.event().name(eventName).data(event, MediaType.APPLICATION_JSON));
            }
        } catch (SubscriptionClosedException e) {
            log.debug("{} stream closed: {}", subscription.getStream(), e.getMessage());
            emitter.complete();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            subscription.close();
            emitter.complete();
        } catch (IOException | IllegalStateException e) {
            log.debug("{} stream client went away: {}", subscription.getStream(), e.getMessage());
            subscription.close();
        }
    }
}
