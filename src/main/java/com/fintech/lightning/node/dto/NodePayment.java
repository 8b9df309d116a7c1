package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outgoing payment record from the node's payment database. Also the unit the
 * send stream emits.
 */
@Value
@Builder(toBuilder = true)
public class NodePayment {

    String paymentHash;

    /**
     * Monotonically increasing, assigned by the node when the payment is initiated.
     * Unsigned on the wire.
     */
    long paymentIndex;

    NodePaymentStatus status;
    long valueMsat;
    long feeMsat;
    String paymentPreimage;

    @Builder.Default
    List<HtlcAttempt> htlcs = List.of();
}
