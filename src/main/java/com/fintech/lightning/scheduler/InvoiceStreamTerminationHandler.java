package com.fintech.lightning.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Shuts the application down when the invoice stream is lost, if
 * {@code lightning.invoices.exit-on-stream-end} is set. Otherwise the failure is only
 * visible through logs and the health endpoint.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvoiceStreamTerminationHandler {

    static final int EXIT_CODE = 1;

    private final ApplicationContext applicationContext;

    @Value("${lightning.invoices.exit-on-stream-end:false}")
    private boolean exitOnStreamEnd;

    @EventListener
    public void onTermination(InvoiceStreamTerminatedEvent event) {
        if (!exitOnStreamEnd) {
            log.warn("Invoice stream lost ({}); restart required to resume settlement notifications", event.getReason());
            return;
        }

        log.error("Invoice stream lost ({}); shutting down", event.getReason());
        Thread exit = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> EXIT_CODE)),
                "invoice-stream-exit");
        exit.start();
    }
}
