package com.fintech.lightning.service;

import com.fintech.lightning.exception.NodeClientException;
import com.fintech.lightning.exception.NodeUnavailableException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs unary node RPCs behind the {@code lightningNode} circuit breaker and, when
 * configured, a per-call deadline.
 * <p>
 * Every failure surfaces as a {@link NodeClientException} naming the RPC. Without
 * {@code lightning.node.call-timeout-ms} calls run on the caller's thread with no deadline.
 */
@Component
@Slf4j
public class NodeCallExecutor {

    public static final String CIRCUIT_BREAKER_NAME = "lightningNode";

    private final CircuitBreaker circuitBreaker;
    private final TimeLimiter timeLimiter;
    private final ExecutorService timeoutExecutor;

    public NodeCallExecutor(CircuitBreakerRegistry circuitBreakerRegistry,
                            TimeLimiterRegistry timeLimiterRegistry,
                            @Value("${lightning.node.call-timeout-ms:0}") long callTimeoutMs) {
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        if (callTimeoutMs > 0) {
            this.timeLimiter = timeLimiterRegistry.timeLimiter(CIRCUIT_BREAKER_NAME);
            this.timeoutExecutor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "node-call");
                thread.setDaemon(true);
                return thread;
            });
            log.info("Lightning node calls limited to {} ms", callTimeoutMs);
        } else {
            this.timeLimiter = null;
            this.timeoutExecutor = null;
        }
    }

    /**
     * @param operation node RPC name, used in errors and logs
     */
    public <T> T call(String operation, Supplier<T> call) {
        Supplier<T> guarded = CircuitBreaker.decorateSupplier(circuitBreaker, withDeadline(operation, call));
        try {
            return guarded.get();
        } catch (CallNotPermittedException e) {
            throw new NodeUnavailableException(operation, e);
        } catch (NodeClientException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new NodeClientException("error calling " + operation + ": " + e.getMessage(), operation, e);
        }
    }

    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker.getState();
    }

    private <T> Supplier<T> withDeadline(String operation, Supplier<T> call) {
        if (timeLimiter == null) {
            return call;
        }
        return () -> {
            try {
                return timeLimiter.executeFutureSupplier(() -> CompletableFuture.supplyAsync(call, timeoutExecutor));
            } catch (RuntimeException e) {
                throw e;
            } catch (TimeoutException e) {
                throw new NodeClientException(operation + " timed out", operation, e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NodeClientException(operation + " interrupted", operation, e);
            } catch (Exception e) {
                throw new NodeClientException("error calling " + operation + ": " + e.getMessage(), operation, e);
            }
        };
    }

    @PreDestroy
    public void shutdown() {
        if (timeoutExecutor != null) {
            timeoutExecutor.shutdownNow();
        }
    }
}
