package com.fintech.lightning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Lightning Wallet Adapter
 * <p>
 * Exposes one wallet contract over a Lightning node and turns the node's mixed
 * notification model into two subscriber streams.
 * <p>
 * Key Features:
 * - Invoice creation/lookup and payment send/lookup
 * - Settlement stream relayed from the node's invoice subscription
 * - Payment status stream built by polling the node's payment database
 * - Fan-out to any number of independent subscribers
 * - Circuit breaker and optional deadline on node calls
 */
@SpringBootApplication
@EnableScheduling
public class LightningWalletApplication {

    public static void main(String[] args) {
        SpringApplication.run(LightningWalletApplication.class, args);
    }
}
