package com.fintech.lightning.config;

import com.fintech.lightning.exception.NodeClientException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Configuration for the Resilience4j guards around Lightning node calls.
 * <p>
 * The circuit breaker stops hammering a node that keeps failing:
 * - CLOSED: Normal operation, calls pass through
 * - OPEN: Node is failing, calls fail fast
 * - HALF_OPEN: Testing if the node has recovered
 * <p>
 * Rejected requests (non-retryable node errors) do not count as failures.
 */
@Configuration
public class ResilienceConfig {

    @Value("${lightning.node.circuit-breaker.sliding-window-size:10}")
    private int slidingWindowSize;

    @Value("${lightning.node.circuit-breaker.failure-rate-threshold:50}")
    private float failureRateThreshold;

    @Value("${lightning.node.circuit-breaker.wait-in-open-state-ms:30000}")
    private long waitInOpenStateMs;

    @Value("${lightning.node.call-timeout-ms:0}")
    private long callTimeoutMs;

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(slidingWindowSize)
                .failureRateThreshold(failureRateThreshold)
                .waitDurationInOpenState(Duration.ofMillis(waitInOpenStateMs))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilienceConfig::isNodeFailure)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Only consulted when {@code lightning.node.call-timeout-ms} is positive.
     */
    @Bean
    public TimeLimiterRegistry timeLimiterRegistry() {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(callTimeoutMs > 0 ? callTimeoutMs : 1))
                .cancelRunningFuture(true)
                .build();

        return TimeLimiterRegistry.of(config);
    }

    static boolean isNodeFailure(Throwable throwable) {
        if (throwable instanceof NodeClientException) {
            return ((NodeClientException) throwable).isRetryable();
        }
        return true;
    }
}
