package uk.gegc.puzzlemaker.shared.exception;

/**
 * Thrown when model output cannot be turned into a puzzle candidate
 */
public class AIResponseParseException extends RuntimeException {

    public AIResponseParseException(String message) {
        super(message);
    }

    public AIResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
