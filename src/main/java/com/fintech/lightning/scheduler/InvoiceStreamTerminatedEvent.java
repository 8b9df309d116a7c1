package com.fintech.lightning.scheduler;

import org.springframework.context.ApplicationEvent;

/**
 * Published once when the node's invoice subscription is gone for good. No further
 * settlements are delivered until the application restarts.
 */
public class InvoiceStreamTerminatedEvent extends ApplicationEvent {

    private final String reason;

    public InvoiceStreamTerminatedEvent(Object source, String reason) {
        super(source);
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
