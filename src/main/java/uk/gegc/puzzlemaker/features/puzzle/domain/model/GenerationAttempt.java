package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import uk.gegc.puzzlemaker.features.difficulty.domain.model.DifficultyCalibration;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityReport;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.UniquenessCheck;

/**
 * One scored iteration of the generation loop.
 */
public record GenerationAttempt(int attemptNumber,
                                PuzzleCandidate candidate,
                                String model,
                                DifficultyCalibration calibration,
                                UniquenessCheck uniqueness,
                                QualityReport qualityReport,
                                long elapsedMs) {

    public int finalScore() {
        return qualityReport.finalScore();
    }
}
