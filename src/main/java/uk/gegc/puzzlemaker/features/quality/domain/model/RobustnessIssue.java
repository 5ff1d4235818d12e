package uk.gegc.puzzlemaker.features.quality.domain.model;

public record RobustnessIssue(IssueSeverity severity, String issue, String suggestion) {
}
