package com.fintech.lightning.service;

import com.fintech.lightning.dto.InvoiceData;
import com.fintech.lightning.dto.InvoiceParams;
import com.fintech.lightning.dto.InvoiceStatus;
import com.fintech.lightning.dto.PaymentData;
import com.fintech.lightning.dto.PaymentParams;
import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.dto.WalletInfo;
import com.fintech.lightning.exception.InvalidCheckingIdException;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.exception.PaymentNotFoundException;
import com.fintech.lightning.exception.WalletException;
import com.fintech.lightning.node.NodeClient;
import com.fintech.lightning.node.NodeStream;
import com.fintech.lightning.node.dto.AddInvoiceRequest;
import com.fintech.lightning.node.dto.AddInvoiceResponse;
import com.fintech.lightning.node.dto.InvoiceState;
import com.fintech.lightning.node.dto.ListPaymentsRequest;
import com.fintech.lightning.node.dto.ListPaymentsResponse;
import com.fintech.lightning.node.dto.NodeInvoice;
import com.fintech.lightning.node.dto.NodePayment;
import com.fintech.lightning.node.dto.SendPaymentRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.HexFormat;
import java.util.Optional;

/**
 * {@link Wallet} backed by an LND-style node.
 * <p>
 * Invoices are keyed by hex payment hash, payments by the node's payment index.
 * Settlement events come from the node's invoice subscription
 * ({@link com.fintech.lightning.scheduler.InvoiceSettlementListener}); payment updates
 * come from polling the payment database
 * ({@link com.fintech.lightning.scheduler.PaymentStatusPoller}), because the node offers
 * no payment subscription. Both feed the broadcasters this wallet hands subscriptions out of.
 */
@Service
@Slf4j
public class LndWallet implements Wallet {

    private static final HexFormat HEX = HexFormat.of();
    private static final int PAYMENT_HASH_LENGTH = 32;

    private final NodeClient nodeClient;
    private final NodeCallExecutor nodeCalls;
    private final PaymentStatusTranslator translator;
    private final StatusBroadcaster<InvoiceStatus> invoiceBroadcaster;
    private final StatusBroadcaster<PaymentStatus> paymentBroadcaster;

    public LndWallet(NodeClient nodeClient,
                     NodeCallExecutor nodeCalls,
                     PaymentStatusTranslator translator,
                     @Qualifier("invoiceBroadcaster") StatusBroadcaster<InvoiceStatus> invoiceBroadcaster,
                     @Qualifier("paymentBroadcaster") StatusBroadcaster<PaymentStatus> paymentBroadcaster) {
        this.nodeClient = nodeClient;
        this.nodeCalls = nodeCalls;
        this.translator = translator;
        this.invoiceBroadcaster = invoiceBroadcaster;
        this.paymentBroadcaster = paymentBroadcaster;
    }

    @Override
    public String kind() {
        return "lnd";
    }

    @Override
    public WalletInfo getInfo() {
        long balance = nodeCalls.call("ChannelBalance", nodeClient::channelBalance);
        return WalletInfo.builder()
                .balance(balance)
                .build();
    }

    @Override
    public InvoiceData createInvoice(InvoiceParams params) {
        if (params.getAmount() < 0) {
            throw new IllegalArgumentException("amount must not be negative");
        }

        AddInvoiceRequest request = AddInvoiceRequest.builder()
                .memo(params.getDescription())
                .descriptionHash(params.getDescriptionHash())
                .valueMsat(params.getAmount())
                .expirySeconds(params.getExpiry() == null ? 0 : params.getExpiry().getSeconds())
                .build();
        AddInvoiceResponse added = nodeCalls.call("AddInvoice", () -> nodeClient.addInvoice(request));

        // AddInvoice only returns the hash, the preimage needs a lookup
        NodeInvoice invoice = nodeCalls.call("LookupInvoice", () -> nodeClient.lookupInvoice(added.getRHash()))
                .orElseThrow(() -> new WalletException(
                        "invoice " + HEX.formatHex(added.getRHash()) + " not found right after creation"));

        log.info("Created invoice {} for {} msat", HEX.formatHex(invoice.getRHash()), params.getAmount());

        return InvoiceData.builder()
                .checkingID(HEX.formatHex(invoice.getRHash()))
                .preimage(invoice.getRPreimage() == null ? "" : HEX.formatHex(invoice.getRPreimage()))
                .invoice(invoice.getPaymentRequest())
                .build();
    }

    @Override
    public InvoiceStatus getInvoiceStatus(String checkingId) {
        byte[] rHash = parsePaymentHash(checkingId);

        Optional<NodeInvoice> invoice = nodeCalls.call("LookupInvoice", () -> nodeClient.lookupInvoice(rHash));
        if (invoice.isEmpty()) {
            log.debug("Invoice {} unknown to node", checkingId);
            return InvoiceStatus.notFound(checkingId);
        }

        boolean paid = invoice.get().getState() == InvoiceState.SETTLED;
        return InvoiceStatus.builder()
                .checkingID(checkingId)
                .exists(true)
                .paid(paid)
                .msatoshiReceived(paid ? invoice.get().getAmtPaidMsat() : 0)
                .build();
    }

    @Override
    public EventSubscription<InvoiceStatus> paidInvoicesStream() {
        return invoiceBroadcaster.subscribe();
    }

    @Override
    public PaymentData makePayment(PaymentParams params) {
        if (params.getInvoice() == null || params.getInvoice().isBlank()) {
            throw new IllegalArgumentException("invoice is required");
        }
        if (params.getCustomAmount() < 0) {
            throw new IllegalArgumentException("customAmount must not be negative");
        }

        SendPaymentRequest request = SendPaymentRequest.builder()
                .paymentRequest(params.getInvoice())
                .amtMsat(params.getCustomAmount())
                .build();

        try (NodeStream<NodePayment> updates = nodeCalls.call("SendPaymentV2", () -> nodeClient.sendPayment(request))) {
            NodePayment first = updates.receive()
                    .orElseThrow(() -> new NodeClientException(
                            "SendPaymentV2 stream ended before acknowledging the payment", "SendPaymentV2"));

            String checkingId = PaymentStatusTranslator.toCheckingId(first.getPaymentIndex());
            log.info("Payment {} initiated", checkingId);

            return PaymentData.builder()
                    .checkingID(checkingId)
                    .build();
        }
    }

    @Override
    public PaymentStatus getPaymentStatus(String checkingId) {
        long index = parsePaymentIndex(checkingId);
        if (index == 0) {
            // The node starts counting at 1
            throw new PaymentNotFoundException(checkingId);
        }

        ListPaymentsRequest request = ListPaymentsRequest.builder()
                .includeIncomplete(true)
                .indexOffset(index - 1)
                .maxPayments(1)
                .reversed(false)
                .build();
        ListPaymentsResponse response = nodeCalls.call("ListPayments", () -> nodeClient.listPayments(request));

        return response.getPayments().stream()
                .filter(payment -> payment.getPaymentIndex() == index)
                .findFirst()
                .map(translator::translate)
                .orElseThrow(() -> new PaymentNotFoundException(checkingId));
    }

    @Override
    public EventSubscription<PaymentStatus> paymentsStream() {
        return paymentBroadcaster.subscribe();
    }

    private static byte[] parsePaymentHash(String checkingId) {
        if (checkingId == null) {
            throw new InvalidCheckingIdException(null, "missing");
        }
        byte[] rHash;
        try {
            rHash = HEX.parseHex(checkingId);
        } catch (IllegalArgumentException e) {
            throw new InvalidCheckingIdException(checkingId, e);
        }
        if (rHash.length != PAYMENT_HASH_LENGTH) {
            throw new InvalidCheckingIdException(checkingId, "expected " + PAYMENT_HASH_LENGTH + " byte payment hash");
        }
        return rHash;
    }

    private static long parsePaymentIndex(String checkingId) {
        if (checkingId == null) {
            throw new InvalidCheckingIdException(null, "missing");
        }
        try {
            return Long.parseUnsignedLong(checkingId);
        } catch (NumberFormatException e) {
            throw new InvalidCheckingIdException(checkingId, e);
        }
    }
}
