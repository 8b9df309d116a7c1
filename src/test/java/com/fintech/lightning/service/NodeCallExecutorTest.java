package com.fintech.lightning.service;

import com.fintech.lightning.config.ResilienceConfig;
import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.exception.NodeUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for NodeCallExecutor with the circuit breaker settings from ResilienceConfig.
 */
class NodeCallExecutorTest {

    private CircuitBreakerRegistry circuitBreakerRegistry;
    private NodeCallExecutor executor;

    @BeforeEach
    void setUp() {
        ResilienceConfig config = new ResilienceConfig();
        ReflectionTestUtils.setField(config, "slidingWindowSize", 2);
        ReflectionTestUtils.setField(config, "failureRateThreshold", 50f);
        ReflectionTestUtils.setField(config, "waitInOpenStateMs", 60_000L);
        circuitBreakerRegistry = config.circuitBreakerRegistry();

        executor = new NodeCallExecutor(circuitBreakerRegistry, TimeLimiterRegistry.ofDefaults(), 0);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    @DisplayName("Should return the node's answer")
    void shouldReturnResult() {
        assertThat(executor.call("ChannelBalance", () -> 42L)).isEqualTo(42L);
        assertThat(executor.getCircuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should wrap unexpected failures with the operation name")
    void shouldWrapRuntimeFailures() {
        assertThatThrownBy(() -> executor.call("AddInvoice", () -> {
            throw new IllegalStateException("channel closed");
        }))
                .isInstanceOf(NodeClientException.class)
                .hasMessageContaining("AddInvoice")
                .hasMessageContaining("channel closed")
                .satisfies(e -> assertThat(((NodeClientException) e).getOperation()).isEqualTo("AddInvoice"));
    }

    @Test
    @DisplayName("Circuit opens after repeated failures and then fails fast")
    void shouldOpenCircuitAfterFailures() {
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> executor.call("ListPayments", () -> {
                throw new NodeClientException("unavailable", "ListPayments");
            })).isInstanceOf(NodeClientException.class);
        }

        assertThat(executor.getCircuitState()).isEqualTo(CircuitBreaker.State.OPEN);

        AtomicInteger invocations = new AtomicInteger();
        assertThatThrownBy(() -> executor.call("ListPayments", invocations::incrementAndGet))
                .isInstanceOf(NodeUnavailableException.class);
        assertThat(invocations).hasValue(0);
    }

    @Test
    @DisplayName("Rejected requests do not open the circuit")
    void shouldNotCountNonRetryableErrors() {
        for (int i = 0; i < 4; i++) {
            assertThatThrownBy(() -> executor.call("SendPaymentV2", () -> {
                throw new NodeClientException("invoice expired", "SendPaymentV2", false);
            })).isInstanceOf(NodeClientException.class);
        }

        assertThat(executor.getCircuitState()).isEqualTo(CircuitBreaker.State.CLOSED);
    }

    @Test
    @DisplayName("Should give up on a call that exceeds the deadline")
    void shouldTimeOutSlowCalls() {
        TimeLimiterRegistry timeLimiters = TimeLimiterRegistry.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(50))
                .cancelRunningFuture(true)
                .build());
        NodeCallExecutor limited = new NodeCallExecutor(circuitBreakerRegistry, timeLimiters, 50);

        try {
            assertThatThrownBy(() -> limited.call("LookupInvoice", () -> {
                try {
                    Thread.sleep(2_000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return "late";
            }))
                    .isInstanceOf(NodeClientException.class)
                    .hasMessageContaining("timed out");
        } finally {
            limited.shutdown();
        }
    }
}
