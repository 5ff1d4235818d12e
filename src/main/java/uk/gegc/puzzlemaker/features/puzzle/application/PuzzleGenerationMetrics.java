package uk.gegc.puzzlemaker.features.puzzle.application;

import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.AcceptanceMode;

import java.time.Duration;

/**
 * Observability hooks for the generation pipeline.
 */
public interface PuzzleGenerationMetrics {

    void recordAttempt();

    void recordAccepted(AcceptanceMode mode, Duration elapsed);

    void recordFailure(Duration elapsed);

    /**
     * @param reason short tag such as {@code validation}, {@code duplicate} or {@code error}
     */
    void recordRejection(String reason);

    void recordModelFallback(CapabilityTier tier);
}
