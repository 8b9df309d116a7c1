package com.fintech.lightning.exception;

/**
 * Raised to a reader of a subscription that was closed, either by its owner or
 * because the broadcaster evicted it for falling too far behind.
 */
public class SubscriptionClosedException extends WalletException {

    public SubscriptionClosedException(String message) {
        super(message);
    }
}
