package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

/**
 * The node only hands back the hash and the encoded request on creation;
 * the preimage needs a follow-up lookup.
 */
@Value
@Builder
public class AddInvoiceResponse {

    byte[] rHash;
    String paymentRequest;
    long addIndex;
}
