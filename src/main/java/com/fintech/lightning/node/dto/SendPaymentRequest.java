package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SendPaymentRequest {

    String paymentRequest;

    /**
     * Zero means pay the amount encoded in the request.
     */
    long amtMsat;
}
