package br.edu.ifba.graphmemory.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Logs what {@code CapabilityGate} does with a failing capability call.
 *
 * <p>Each event is written with these MDC keys set, and they are removed again before the
 * method returns:</p>
 * <ul>
 *   <li><code>retry.operation</code> - capability operation, e.g. {@code extract}</li>
 *   <li><code>retry.attempt</code> - attempt number, 1-based</li>
 *   <li><code>retry.max</code> - configured attempt limit (attempt events only)</li>
 *   <li><code>retry.exception</code> - simple class name of the failure</li>
 * </ul>
 *
 * <pre>
 * INFO  Retrying extract (attempt 2 of 4) after RateLimitedException: 429 from provider
 * WARN  Giving up on extract after 4 attempt(s): RateLimitedException: 429 from provider
 * INFO  extract recovered on attempt 3
 * </pre>
 */
public class RetryEventLogger {

    private static final Logger logger = LoggerFactory.getLogger(RetryEventLogger.class);

    static final String KEY_OPERATION = "retry.operation";
    static final String KEY_ATTEMPT = "retry.attempt";
    static final String KEY_MAX = "retry.max";
    static final String KEY_EXCEPTION = "retry.exception";

    private static final int MESSAGE_LIMIT = 200;

    /**
     * Called before attempt {@code attempt} runs because the previous one failed.
     */
    public void logRetryAttempt(final String operation, final int attempt, final int maxAttempts, final Throwable failure) {
        try (MDC.MDCCloseable op = MDC.putCloseable(KEY_OPERATION, operation);
             MDC.MDCCloseable at = MDC.putCloseable(KEY_ATTEMPT, Integer.toString(attempt));
             MDC.MDCCloseable max = MDC.putCloseable(KEY_MAX, Integer.toString(maxAttempts));
             MDC.MDCCloseable ex = MDC.putCloseable(KEY_EXCEPTION, failureType(failure))) {
            logger.info("Retrying {} (attempt {} of {}) after {}",
                operation, attempt, maxAttempts, describe(failure));
        }
    }

    /**
     * Called once the gate stops trying, whether attempts ran out or the failure was a refusal.
     */
    public void logRetryExhausted(final String operation, final int totalAttempts, final Throwable failure) {
        try (MDC.MDCCloseable op = MDC.putCloseable(KEY_OPERATION, operation);
             MDC.MDCCloseable at = MDC.putCloseable(KEY_ATTEMPT, Integer.toString(totalAttempts));
             MDC.MDCCloseable ex = MDC.putCloseable(KEY_EXCEPTION, failureType(failure))) {
            logger.warn("Giving up on {} after {} attempt(s): {}", operation, totalAttempts, describe(failure));
        }
    }

    /**
     * Called on success; silent when the first attempt succeeded.
     */
    public void logRetrySuccess(final String operation, final int totalAttempts) {
        if (totalAttempts > 1) {
            try (MDC.MDCCloseable op = MDC.putCloseable(KEY_OPERATION, operation);
                 MDC.MDCCloseable at = MDC.putCloseable(KEY_ATTEMPT, Integer.toString(totalAttempts))) {
                logger.info("{} recovered on attempt {}", operation, totalAttempts);
            }
        }
    }

    private static String failureType(final Throwable failure) {
        return failure == null ? "unknown" : failure.getClass().getSimpleName();
    }

    static String describe(final Throwable failure) {
        if (failure == null) {
            return "unknown failure";
        }
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failureType(failure);
        }
        if (message.length() > MESSAGE_LIMIT) {
            message = message.substring(0, MESSAGE_LIMIT) + "...";
        }
        return failureType(failure) + ": " + message;
    }
}
