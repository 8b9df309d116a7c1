package com.fintech.lightning.config;

import com.fintech.lightning.dto.InvoiceStatus;
import com.fintech.lightning.dto.PaymentStatus;
import com.fintech.lightning.service.StatusBroadcaster;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Subscriber sets for the two event classes and the executor that relays them to
 * HTTP event-stream clients.
 * <p>
 * {@code lightning.subscriptions.max-pending} bounds each subscriber's backlog;
 * 0 keeps it unbounded.
 */
@Configuration
public class WalletConfig {

    @Value("${lightning.subscriptions.max-pending:0}")
    private int maxPending;

    @Bean
    public StatusBroadcaster<InvoiceStatus> invoiceBroadcaster(MeterRegistry meterRegistry) {
        return new StatusBroadcaster<>("invoices", maxPending, meterRegistry);
    }

    @Bean
    public StatusBroadcaster<PaymentStatus> paymentBroadcaster(MeterRegistry meterRegistry) {
        return new StatusBroadcaster<>("payments", maxPending, meterRegistry);
    }

    @Bean
    public ThreadPoolTaskExecutor streamRelayExecutor(
            @Value("${lightning.http.stream-relay-threads:16}") int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("stream-relay-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }
}
