package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ListPaymentsResponse {

    @Builder.Default
    List<NodePayment> payments = List.of();

    long firstIndexOffset;

    /**
     * Cursor to pass as {@code indexOffset} to continue after this page.
     */
    long lastIndexOffset;
}
