package uk.gegc.puzzlemaker.shared.exception;

/**
 * Exception thrown when a generative backend call fails.
 * Always carries an {@link AiErrorCode} so callers never re-parse messages.
 */
public class AiServiceException extends RuntimeException {

    private final AiErrorCode code;

    public AiServiceException(String message, AiErrorCode code) {
        super(message);
        this.code = code == null ? AiErrorCode.UNKNOWN : code;
    }

    public AiServiceException(String message, AiErrorCode code, Throwable cause) {
        super(message, cause);
        this.code = code == null ? AiErrorCode.UNKNOWN : code;
    }

    public AiErrorCode getCode() {
        return code;
    }
}
