package com.fintech.lightning.node.dto;

/**
 * Native invoice states as the node reports them.
 */
public enum InvoiceState {
    OPEN,
    SETTLED,
    CANCELED,
    /**
     * HTLCs are held but not yet settled (hold invoices).
     */
    ACCEPTED
}
