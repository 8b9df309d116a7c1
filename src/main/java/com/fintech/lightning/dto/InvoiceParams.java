package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Request to create an incoming-payment invoice.
 * <p>
 * Backends decide whether {@code description} or {@code descriptionHash} ends up in the
 * encoded request; both are passed through.
 */
@Value
@Builder
@Jacksonized
public class InvoiceParams {

    /**
     * Amount in millisatoshi. Zero creates an any-amount invoice.
     */
    long amount;

    String description;

    /**
     * SHA-256 of a long description, sent instead of the memo by hash-committing backends.
     */
    byte[] descriptionHash;

    /**
     * Null means the backend default expiry.
     */
    Duration expiry;
}
