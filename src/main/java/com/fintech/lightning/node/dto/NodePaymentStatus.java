package com.fintech.lightning.node.dto;

public enum NodePaymentStatus {
    UNKNOWN,
    IN_FLIGHT,
    SUCCEEDED,
    FAILED,
    INITIATED;

    /**
     * True while the node may still change the payment's outcome.
     */
    public boolean isInProgress() {
        return this == IN_FLIGHT || this == INITIATED;
    }
}
