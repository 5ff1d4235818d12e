package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

public record SimilarityConflict(String puzzleId, String answer, double similarity) {
}
