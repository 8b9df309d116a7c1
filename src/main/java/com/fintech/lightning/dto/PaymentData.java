package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Acknowledgement of a payment attempt. For LND the checking id is the node's
 * payment index in decimal, not the payment hash.
 */
@Value
@Builder
@Jacksonized
public class PaymentData {

    String checkingID;
}
