package br.edu.ifba.graphmemory.capability;

import br.edu.ifba.graphmemory.config.GraphMemoryConfig;
import br.edu.ifba.graphmemory.exception.CapabilityException;
import br.edu.ifba.graphmemory.exception.CapabilityUnavailableException;
import br.edu.ifba.graphmemory.exception.RefusedException;
import br.edu.ifba.graphmemory.utils.RetryEventLogger;
import io.smallrye.faulttolerance.api.FaultTolerance;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Single entry point for every capability call.
 *
 * <p>Bounds the number of calls in flight with a fair semaphore shared by all namespaces:
 * callers beyond the bound wait for a permit instead of failing. A permit is held only
 * for one attempt, never across a backoff delay. Capability failures are retried with
 * exponential backoff through SmallRye Fault Tolerance; {@link RefusedException} aborts
 * immediately. Once retries are exhausted the failure surfaces as
 * {@link CapabilityUnavailableException}.</p>
 */
public class CapabilityGate {

    private static final Logger logger = LoggerFactory.getLogger(CapabilityGate.class);

    private final Semaphore permits;
    private final int maxConcurrentCalls;
    private final int maxAttempts;
    private final FaultTolerance<Object> retry;
    private final RetryEventLogger retryEventLogger;

    public CapabilityGate(@NotNull GraphMemoryConfig.Capability config) {
        this(config, new RetryEventLogger());
    }

    public CapabilityGate(@NotNull GraphMemoryConfig.Capability config, @NotNull RetryEventLogger retryEventLogger) {
        this.maxConcurrentCalls = config.maxConcurrentCalls();
        this.permits = new Semaphore(maxConcurrentCalls, true);
        this.maxAttempts = config.maxRetries() + 1;
        this.retryEventLogger = retryEventLogger;
        this.retry = FaultTolerance.<Object>create()
            .withRetry()
                .maxRetries(config.maxRetries())
                .delay(config.initialDelayMs(), ChronoUnit.MILLIS)
                .jitter(0, ChronoUnit.MILLIS)
                .retryOn(CapabilityException.class)
                .abortOn(RefusedException.class)
                .withExponentialBackoff()
                    .factor(2)
                    .maxDelay(Math.max(config.maxDelayMs(), config.initialDelayMs()), ChronoUnit.MILLIS)
                    .done()
                .done()
            .build();
        logger.info("Capability gate initialized: maxConcurrentCalls={}, maxAttempts={}, initialDelay={}ms",
            maxConcurrentCalls, maxAttempts, config.initialDelayMs());
    }

    /**
     * Runs a capability call with concurrency limiting and retries.
     *
     * @param operation  name used in logs and errors, e.g. {@code extract}
     * @param invocation starts one attempt; called again on every retry
     * @return the value of the first successful attempt
     * @throws CapabilityUnavailableException when retries are exhausted or the call was refused
     */
    public <T> T call(@NotNull String operation, @NotNull Supplier<CompletableFuture<T>> invocation) {
        return call(operation, invocation, null);
    }

    /**
     * Same as {@link #call(String, Supplier)}, with a per-attempt timeout.
     * A timed-out attempt counts as a retryable failure.
     */
    @SuppressWarnings("unchecked")
    public <T> T call(
            @NotNull String operation,
            @NotNull Supplier<CompletableFuture<T>> invocation,
            @Nullable Duration timeout) {
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Throwable> lastFailure = new AtomicReference<>();
        try {
            T result = (T) retry.call(() -> attempt(operation, invocation, timeout, attempts, lastFailure));
            retryEventLogger.logRetrySuccess(operation, attempts.get());
            return result;
        } catch (CapabilityException e) {
            retryEventLogger.logRetryExhausted(operation, attempts.get(), e);
            throw new CapabilityUnavailableException(operation, attempts.get(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CapabilityUnavailableException(operation, attempts.get(), e);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new CapabilityUnavailableException(operation, attempts.get(), e);
        }
    }

    private <T> T attempt(
            String operation,
            Supplier<CompletableFuture<T>> invocation,
            @Nullable Duration timeout,
            AtomicInteger attempts,
            AtomicReference<Throwable> lastFailure) throws InterruptedException {
        int attempt = attempts.incrementAndGet();
        if (attempt > 1) {
            retryEventLogger.logRetryAttempt(operation, attempt, maxAttempts, lastFailure.get());
        }

        permits.acquire();
        CompletableFuture<T> future = null;
        try {
            future = invocation.get();
            if (future == null) {
                throw new CapabilityException(operation + " returned no future");
            }
            return timeout != null
                ? future.get(timeout.toMillis(), TimeUnit.MILLISECONDS)
                : future.get();
        } catch (ExecutionException | CompletionException e) {
            throw remember(lastFailure, asCapabilityFailure(operation, e.getCause() != null ? e.getCause() : e));
        } catch (TimeoutException e) {
            future.cancel(true);
            throw remember(lastFailure, new CapabilityException(
                String.format("%s timed out after %d ms", operation, timeout.toMillis()), e));
        } catch (CapabilityException e) {
            throw remember(lastFailure, e);
        } catch (RuntimeException e) {
            throw remember(lastFailure, asCapabilityFailure(operation, e));
        } finally {
            permits.release();
        }
    }

    private static CapabilityException remember(AtomicReference<Throwable> lastFailure, CapabilityException failure) {
        lastFailure.set(failure);
        return failure;
    }

    private static CapabilityException asCapabilityFailure(String operation, Throwable cause) {
        if (cause instanceof CapabilityException capabilityException) {
            return capabilityException;
        }
        return new CapabilityException(operation + " failed: " + cause.getMessage(), cause);
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int getMaxConcurrentCalls() {
        return maxConcurrentCalls;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
