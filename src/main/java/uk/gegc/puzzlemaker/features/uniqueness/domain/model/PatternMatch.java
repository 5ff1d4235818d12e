package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

import java.util.List;

/**
 * @param primary     first heuristic that matched, or UNKNOWN
 * @param subPatterns every heuristic that matched, in evaluation order
 */
public record PatternMatch(PatternType primary, double confidence, List<PatternType> subPatterns) {

    public PatternMatch {
        subPatterns = List.copyOf(subPatterns);
    }
}
