package com.fintech.lightning.node;

import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.node.dto.AddInvoiceRequest;
import com.fintech.lightning.node.dto.AddInvoiceResponse;
import com.fintech.lightning.node.dto.ListPaymentsRequest;
import com.fintech.lightning.node.dto.ListPaymentsResponse;
import com.fintech.lightning.node.dto.NodeInvoice;
import com.fintech.lightning.node.dto.NodePayment;
import com.fintech.lightning.node.dto.SendPaymentRequest;

import java.util.Optional;

/**
 * RPC surface of a Lightning node, as consumed by the wallet adapter.
 * <p>
 * Implementations own transport, TLS and credentials (e.g. an LND gRPC channel with a
 * macaroon). None of the calls carry a deadline; a hung node hangs the caller unless the
 * adapter is configured with a call timeout.
 * <p>
 * The in-memory implementation simulates a node for local runs and tests.
 */
public interface NodeClient {

    /**
     * Local channel balance in satoshi.
     *
     * @throws NodeClientException if the node cannot be reached
     */
    long channelBalance() throws NodeClientException;

    AddInvoiceResponse addInvoice(AddInvoiceRequest request) throws NodeClientException;

    /**
     * @param rHash payment hash
     * @return the invoice, or empty if the node does not know the hash
     * @throws NodeClientException on transport or RPC failure other than "not found"
     */
    Optional<NodeInvoice> lookupInvoice(byte[] rHash) throws NodeClientException;

    /**
     * Opens the node's invoice event stream. Every invoice state change is emitted,
     * not only settlements.
     */
    NodeStream<NodeInvoice> subscribeInvoices() throws NodeClientException;

    /**
     * Starts a payment. The stream emits the payment record each time it changes;
     * the first message arrives once the node has registered the attempt and carries
     * its payment index.
     */
    NodeStream<NodePayment> sendPayment(SendPaymentRequest request) throws NodeClientException;

    ListPaymentsResponse listPayments(ListPaymentsRequest request) throws NodeClientException;

    /**
     * Returns the name of this node backend.
     * Used for logging and metrics.
     */
    String getNodeName();
}
