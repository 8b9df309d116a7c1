package com.fintech.lightning.exception;

/**
 * A checking id that cannot be parsed into the backend's native key space.
 * Distinct from "not found": the id was never a possible key.
 */
public class InvalidCheckingIdException extends WalletException {

    private final String checkingId;

    public InvalidCheckingIdException(String checkingId, Throwable cause) {
        super("invalid checkingID: " + checkingId, cause);
        this.checkingId = checkingId;
    }

    public InvalidCheckingIdException(String checkingId, String reason) {
        super("invalid checkingID: " + checkingId + " (" + reason + ")");
        this.checkingId = checkingId;
    }

    public String getCheckingId() {
        return checkingId;
    }
}
