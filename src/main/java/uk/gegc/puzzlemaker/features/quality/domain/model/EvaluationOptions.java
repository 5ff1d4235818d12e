package uk.gegc.puzzlemaker.features.quality.domain.model;

public record EvaluationOptions(QualityThresholds thresholds, boolean runRobustness) {
}
