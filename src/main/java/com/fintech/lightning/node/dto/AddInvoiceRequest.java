package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AddInvoiceRequest {

    String memo;
    byte[] descriptionHash;
    long valueMsat;

    /**
     * Zero leaves the node default in place.
     */
    long expirySeconds;
}
