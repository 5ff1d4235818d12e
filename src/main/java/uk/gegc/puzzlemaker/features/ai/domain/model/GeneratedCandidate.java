package uk.gegc.puzzlemaker.features.ai.domain.model;

import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;

/**
 * @param model the model in the chain that produced the candidate
 */
public record GeneratedCandidate(PuzzleCandidate candidate, String model, UsageStats usage) {
}
