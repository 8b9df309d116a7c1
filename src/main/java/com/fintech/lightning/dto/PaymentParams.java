package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Request to pay an encoded invoice.
 */
@Value
@Builder
@Jacksonized
public class PaymentParams {

    String invoice;

    /**
     * Millisatoshi to send. Zero uses the amount encoded in the invoice; anything else
     * overrides it (needed for zero-amount invoices).
     */
    long customAmount;
}
