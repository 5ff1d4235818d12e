package uk.gegc.puzzlemaker.features.puzzle.domain.model;

/**
 * Named sub-factor of a complexity profile and its weight in the difficulty score.
 */
public record ComplexityFactor(String name, double weight) {
}
