package uk.gegc.puzzlemaker.features.puzzle.domain.model;

/**
 * How a result got past the quality gate.
 */
public enum AcceptanceMode {
    /** met the attempt's threshold with a publish verdict */
    PUBLISHED,
    /** high overall score on a retry, verdict notwithstanding */
    HIGH_QUALITY_BYPASS,
    /** best attempt after the budget ran out, above the minimum acceptable score */
    BEST_EFFORT
}
