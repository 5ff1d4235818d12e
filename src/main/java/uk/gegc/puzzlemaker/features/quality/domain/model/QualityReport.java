package uk.gegc.puzzlemaker.features.quality.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one quality evaluation.
 *
 * @param overall    weighted average of the dimension scores
 * @param finalScore overall blended with the robustness score, or overall when robustness was not checked
 * @param robustness null when the robustness check was skipped
 */
public record QualityReport(Map<QualityDimension, Integer> dimensionScores,
                            int overall,
                            int finalScore,
                            Verdict verdict,
                            List<String> actionItems,
                            RobustnessReport robustness,
                            QualityThresholds thresholds) {

    public QualityReport {
        dimensionScores = dimensionScores.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(dimensionScores));
        actionItems = List.copyOf(actionItems);
    }

    public boolean passed() {
        return verdict == Verdict.PUBLISH;
    }

    public boolean robustnessChecked() {
        return robustness != null;
    }

    /**
     * Dimension scores keyed by dimension name.
     */
    public Map<String, Integer> breakdown() {
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        dimensionScores.forEach((dimension, score) -> breakdown.put(dimension.key(), score));
        return breakdown;
    }
}
