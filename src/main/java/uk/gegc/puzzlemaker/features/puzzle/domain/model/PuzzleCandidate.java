package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import java.util.List;

/**
 * A puzzle as produced by the model. Immutable; calibration and scoring produce
 * separate values instead of mutating the candidate.
 *
 * @param content            the rebus symbols or word-puzzle text
 * @param proposedDifficulty the model's own difficulty claim, may be null
 */
public record PuzzleCandidate(PuzzleType type,
                              String content,
                              String answer,
                              String explanation,
                              List<String> hints,
                              String category,
                              Integer proposedDifficulty,
                              ComplexityProfile complexity) {

    public PuzzleCandidate {
        hints = hints == null ? List.of() : List.copyOf(hints);
        complexity = complexity == null ? ComplexityProfile.empty() : complexity;
    }
}
