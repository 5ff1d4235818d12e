package uk.gegc.puzzlemaker.features.difficulty.domain.model;

/**
 * @param rawScore       weighted sub-factor sum (or heuristic estimate) before rounding and clamping
 * @param profileUsed    false when the candidate had no complexity profile and the heuristic was used
 * @param recommendation how far the model's own claim is from the calibrated value
 */
public record DifficultyCalibration(int calibratedDifficulty,
                                    Integer proposedDifficulty,
                                    double rawScore,
                                    boolean profileUsed,
                                    String recommendation) {

    public static final String MISMATCH = "Difficulty mismatch: proposed and calibrated values differ significantly";
    public static final String MINOR_ADJUSTMENT = "Minor adjustment: calibrated difficulty differs slightly from the proposed value";
    public static final String ACCURATE = "Difficulty accurately calibrated";
    public static final String NOT_PROPOSED = "No proposed difficulty to compare against";
}
