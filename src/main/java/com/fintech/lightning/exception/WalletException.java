package com.fintech.lightning.exception;

/**
 * Base exception for wallet operations.
 */
public class WalletException extends RuntimeException {

    public WalletException(String message) {
        super(message);
    }

    public WalletException(String message, Throwable cause) {
        super(message, cause);
    }
}
