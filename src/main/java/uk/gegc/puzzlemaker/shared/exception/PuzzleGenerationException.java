package uk.gegc.puzzlemaker.shared.exception;

import java.util.Map;

/**
 * Raised when the orchestrator exhausts its attempt budget without an acceptable puzzle.
 * Carries the best score seen (null when no attempt reached scoring) and its dimension breakdown.
 */
public class PuzzleGenerationException extends RuntimeException {

    private final Integer bestScore;
    private final int attempts;
    private final String reason;
    private final Map<String, Integer> breakdown;

    public PuzzleGenerationException(String reason, Integer bestScore, int attempts, Map<String, Integer> breakdown) {
        super(buildMessage(reason, bestScore, attempts));
        this.reason = reason;
        this.bestScore = bestScore;
        this.attempts = attempts;
        this.breakdown = breakdown == null ? Map.of() : Map.copyOf(breakdown);
    }

    private static String buildMessage(String reason, Integer bestScore, int attempts) {
        return String.format("Failed to generate an acceptable puzzle after %d attempts (best score: %s): %s",
                attempts, bestScore == null ? "none" : bestScore, reason);
    }

    public Integer getBestScore() {
        return bestScore;
    }

    public int getAttempts() {
        return attempts;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Integer> getBreakdown() {
        return breakdown;
    }
}
