package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time view of an invoice.
 * <p>
 * {@code exists == false} is a valid answer for an id the backend does not know,
 * not an error. Use {@link #notFound(String)} for that case so that {@code paid} and
 * {@code msatoshiReceived} stay zeroed.
 */
@Value
@Builder
@Jacksonized
public class InvoiceStatus {

    String checkingID;
    boolean exists;
    boolean paid;
    long msatoshiReceived;

    public static InvoiceStatus notFound(String checkingID) {
        return InvoiceStatus.builder()
                .checkingID(checkingID)
                .exists(false)
                .paid(false)
                .msatoshiReceived(0)
                .build();
    }

    public static InvoiceStatus settled(String checkingID, long msatoshiReceived) {
        return InvoiceStatus.builder()
                .checkingID(checkingID)
                .exists(true)
                .paid(true)
                .msatoshiReceived(msatoshiReceived)
                .build();
    }
}
