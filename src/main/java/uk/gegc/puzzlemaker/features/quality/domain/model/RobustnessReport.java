package uk.gegc.puzzlemaker.features.quality.domain.model;

import java.util.List;

/**
 * @param passed true when no critical issue was found
 */
public record RobustnessReport(int score, boolean passed, List<RobustnessIssue> issues) {

    public RobustnessReport {
        issues = List.copyOf(issues);
    }
}
