package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Invoice record as returned by a lookup and carried by invoice subscription events.
 */
@Value
@Builder(toBuilder = true)
public class NodeInvoice {

    byte[] rHash;

    /**
     * Empty until known; a node that generated the preimage itself returns it right away.
     */
    byte[] rPreimage;

    String paymentRequest;
    String memo;
    long valueMsat;
    InvoiceState state;
    long amtPaidMsat;
    long addIndex;
    long settleIndex;
}
