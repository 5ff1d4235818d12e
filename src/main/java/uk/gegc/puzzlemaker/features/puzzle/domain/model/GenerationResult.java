package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import uk.gegc.puzzlemaker.features.quality.domain.model.QualityReport;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PatternType;

/**
 * An accepted puzzle.
 *
 * @param attempts  attempts used, between 1 and the request's budget
 * @param elapsedMs wall time of the whole request
 */
public record GenerationResult(PuzzleCandidate candidate,
                               int calibratedDifficulty,
                               QualityReport qualityReport,
                               String fingerprint,
                               double uniquenessScore,
                               PatternType patternType,
                               String model,
                               int attempts,
                               long elapsedMs,
                               AcceptanceMode acceptance) {

    public static GenerationResult from(GenerationAttempt attempt, int attempts, long elapsedMs,
                                        AcceptanceMode acceptance) {
        return new GenerationResult(
                attempt.candidate(),
                attempt.calibration().calibratedDifficulty(),
                attempt.qualityReport(),
                attempt.uniqueness().fingerprint(),
                attempt.uniqueness().uniquenessScore(),
                attempt.uniqueness().patternType(),
                attempt.model(),
                attempts,
                elapsedMs,
                acceptance);
    }
}
