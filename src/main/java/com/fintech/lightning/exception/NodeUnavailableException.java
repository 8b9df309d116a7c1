package com.fintech.lightning.exception;

/**
 * The node circuit breaker is open; calls are rejected without reaching the node.
 */
public class NodeUnavailableException extends NodeClientException {

    public NodeUnavailableException(String operation, Throwable cause) {
        super("Lightning node is temporarily unavailable (circuit open) for " + operation, operation, cause);
    }
}
