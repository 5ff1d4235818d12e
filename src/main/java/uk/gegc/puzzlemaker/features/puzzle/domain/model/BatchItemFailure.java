package uk.gegc.puzzlemaker.features.puzzle.domain.model;

public record BatchItemFailure(int index, int targetDifficulty, String reason, Integer bestScore) {
}
