package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Result of a successful invoice creation.
 */
@Value
@Builder
@Jacksonized
public class InvoiceData {

    /**
     * Backend identity used for every later lookup (hex payment hash for LND).
     */
    String checkingID;

    /**
     * Hex preimage; may be empty until settlement on some backends.
     */
    String preimage;

    /**
     * Encoded payment request, opaque to this layer.
     */
    String invoice;
}
