package uk.gegc.puzzlemaker.features.ai.infra.parser;

import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

/**
 * Turns raw model output into a {@link PuzzleCandidate}. Missing fields become null or
 * empty so that validation can report them; only unreadable output is an error.
 */
public interface PuzzleCandidateParser {

    PuzzleCandidate parse(String rawResponse, PuzzleType puzzleType);
}
