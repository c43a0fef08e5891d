package com.kotsin.stdev.retry;

import com.kotsin.stdev.config.ProcessingConstants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.function.Supplier;

/**
 * Retry handler with exponential backoff, used around state file writes.
 */
@Component
@Slf4j
public class RetryHandler {

    private final long initialDelayMs;

    public RetryHandler() {
        this(ProcessingConstants.INITIAL_RETRY_DELAY_MS);
    }

    public RetryHandler(long initialDelayMs) {
        this.initialDelayMs = initialDelayMs;
    }

    public <T> T executeWithRetry(Supplier<T> operation, String operationName) {
        return executeWithRetry(operation, operationName, ProcessingConstants.MAX_RETRY_ATTEMPTS);
    }

    /**
     * Execute operation, retrying only failures {@link #isRetryable(Exception)} accepts.
     */
    public <T> T executeWithRetry(Supplier<T> operation, String operationName, int maxAttempts) {
        int attempt = 0;
        RuntimeException lastException = null;

        while (attempt < maxAttempts) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                lastException = e;
                attempt++;

                if (!isRetryable(e)) {
                    log.error("❌ Operation '{}' failed with non-retryable error: {}", operationName, e.getMessage());
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    log.error("❌ Operation '{}' failed after {} attempts", operationName, maxAttempts);
                    break;
                }

                long delayMs = calculateBackoffDelay(attempt);
                log.warn("⚠️ Operation '{}' failed (attempt {}/{}). Retrying in {}ms. Error: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("Retry interrupted", ie);
                }
            }
        }

        throw new IllegalStateException(
            String.format("Operation '%s' failed after %d attempts", operationName, maxAttempts),
            lastException
        );
    }

    public void executeWithRetry(Runnable operation, String operationName) {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName);
    }

    private long calculateBackoffDelay(int attempt) {
        long delay = (long) (initialDelayMs *
            Math.pow(ProcessingConstants.RETRY_BACKOFF_MULTIPLIER, attempt - 1));

        return Math.min(delay, ProcessingConstants.MAX_RETRY_DELAY_MS);
    }

    /**
     * I/O failures are transient; anything else is a bug or bad data and is not retried.
     */
    public boolean isRetryable(Exception e) {
        if (e instanceof UncheckedIOException || e instanceof IOException) {
            return true;
        }
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
            return true;
        }

        String message = e.getMessage();
        if (message != null) {
            return message.contains("timeout") ||
                   message.contains("temporarily unavailable");
        }

        return false;
    }
}
