package uk.gegc.puzzlemaker.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.ai.infra.AiErrorClassifier;
import uk.gegc.puzzlemaker.shared.config.AiRateLimitConfig;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.util.function.Supplier;

/**
 * Retries an operation with exponential backoff while its failures are transient.
 * Quota exhaustion and fatal errors are rethrown at once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AiRetryExecutor {

    private final AiRateLimitConfig rateLimitConfig;
    private final AiErrorClassifier errorClassifier;

    public <T> T withRetry(Supplier<T> operation) {
        return withRetry(operation, rateLimitConfig.getMaxAttempts());
    }

    public <T> T withRetry(Supplier<T> operation, int maxAttempts) {
        int attempts = Math.max(1, maxAttempts);
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException e) {
                AiServiceException classified = errorClassifier.classify(e);
                AiErrorCode code = classified.getCode();
                if (!code.isBackoffRetryable() || attempt >= attempts) {
                    if (attempt > 1) {
                        log.error("AI operation failed after {} attempt(s) with {}", attempt, code);
                    }
                    throw classified;
                }
                long delayMs = calculateBackoffDelay(attempt);
                log.warn("AI operation attempt {}/{} failed with {}. Retrying in {} ms",
                        attempt, attempts, code, delayMs);
                sleep(delayMs);
            }
        }
    }

    /**
     * Delay after the given (1-based) failed attempt: base * multiplier^(attempt-1), capped.
     */
    long calculateBackoffDelay(int attempt) {
        double exponential = rateLimitConfig.getBaseDelayMs()
                * Math.pow(rateLimitConfig.getMultiplier(), attempt - 1);
        double jitterRange = rateLimitConfig.getJitterFactor();
        if (jitterRange > 0) {
            exponential *= (1.0 - jitterRange) + (Math.random() * 2 * jitterRange);
        }
        return Math.min((long) exponential, rateLimitConfig.getMaxDelayMs());
    }

    protected void sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new AiServiceException("Interrupted while backing off", AiErrorCode.UNKNOWN, ie);
        }
    }
}
