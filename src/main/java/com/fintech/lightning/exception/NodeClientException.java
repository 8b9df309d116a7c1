package com.fintech.lightning.exception;

/**
 * Thrown when a call to the Lightning node fails.
 * This covers connectivity problems, rejected credentials, RPC errors and deadlines.
 */
public class NodeClientException extends WalletException {

    private final String operation;
    private final boolean isRetryable;

    public NodeClientException(String message, String operation) {
        super(message);
        this.operation = operation;
        this.isRetryable = true;
    }

    public NodeClientException(String message, String operation, boolean isRetryable) {
        super(message);
        this.operation = operation;
        this.isRetryable = isRetryable;
    }

    public NodeClientException(String message, String operation, Throwable cause) {
        super(message, cause);
        this.operation = operation;
        this.isRetryable = true;
    }

    /**
     * Name of the node RPC that failed, e.g. {@code ListPayments}.
     */
    public String getOperation() {
        return operation;
    }

    /**
     * Indicates if this error is transient and the call can be repeated.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
