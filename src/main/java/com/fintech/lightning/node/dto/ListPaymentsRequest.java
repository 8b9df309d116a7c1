package com.fintech.lightning.node.dto;

import lombok.Builder;
import lombok.Value;

/**
 * Cursor-based listing of the payment database.
 */
@Value
@Builder
public class ListPaymentsRequest {

    /**
     * Include payments that are still in flight or failed.
     */
    boolean includeIncomplete;

    /**
     * Exclusive start index (or exclusive end index when {@code reversed}).
     */
    long indexOffset;

    /**
     * Zero lets the node apply its own page size.
     */
    long maxPayments;

    boolean reversed;
}
