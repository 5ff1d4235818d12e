package uk.gegc.puzzlemaker.shared.exception;

/**
 * Classification of generative backend failures.
 * <p>
 * {@code fallbackEligible} codes let the model chain move on to the next model.
 * {@code backoffRetryable} codes are retried with exponential backoff once the chain is exhausted.
 * Everything else is fatal for the current generation request.
 */
public enum AiErrorCode {

    MODEL_NOT_FOUND(true, false),
    QUOTA_EXCEEDED(true, false),
    RATE_LIMITED(true, true),
    GATEWAY_FAILURE(true, true),
    PROVIDER_UNAVAILABLE(true, true),
    TIMEOUT(true, true),
    INVALID_REQUEST(false, false),
    AUTHENTICATION(false, false),
    UNKNOWN(false, false);

    private final boolean fallbackEligible;
    private final boolean backoffRetryable;

    AiErrorCode(boolean fallbackEligible, boolean backoffRetryable) {
        this.fallbackEligible = fallbackEligible;
        this.backoffRetryable = backoffRetryable;
    }

    public boolean isFallbackEligible() {
        return fallbackEligible;
    }

    public boolean isBackoffRetryable() {
        return backoffRetryable;
    }

    public boolean isFatal() {
        return !fallbackEligible;
    }
}
