package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

/**
 * A single routing attempt made on behalf of a payment.
 */
@Value
@Builder
public class HtlcAttempt {

    long attemptId;
    Status status;

    public enum Status {
        IN_FLIGHT,
        SUCCEEDED,
        FAILED
    }
}
