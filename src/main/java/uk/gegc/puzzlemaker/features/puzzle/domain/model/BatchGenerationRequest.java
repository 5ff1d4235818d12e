package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import lombok.Builder;

@Builder
public record BatchGenerationRequest(int count,
                                     int startDifficulty,
                                     DifficultyProgression progression,
                                     String category,
                                     boolean ensureVariety,
                                     PuzzleType puzzleType) {
}
