package com.fintech.lightning.dto;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Point-in-time view of an outgoing payment.
 * Fee and preimage are only populated for {@link Status#COMPLETE}.
 */
@Value
@Builder
@Jacksonized
public class PaymentStatus {

    String checkingID;
    Status status;

    @Builder.Default
    long feePaid = 0;

    @Builder.Default
    String preimage = "";
}
