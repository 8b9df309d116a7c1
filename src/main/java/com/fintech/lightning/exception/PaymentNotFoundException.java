package com.fintech.lightning.exception;

public class PaymentNotFoundException extends WalletException {

    private final String checkingId;

    public PaymentNotFoundException(String checkingId) {
        super("payment with ID " + checkingId + " not found");
        this.checkingId = checkingId;
    }

    public String getCheckingId() {
        return checkingId;
    }
}
