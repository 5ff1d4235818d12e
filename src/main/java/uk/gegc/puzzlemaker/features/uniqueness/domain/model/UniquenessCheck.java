package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

import java.util.List;

/**
 * Outcome of comparing a candidate with recent history.
 *
 * @param maxSimilarity    highest similarity among the conflicts, 1.0 for an exact duplicate, 0 when none
 * @param uniquenessScore  0-100, 0 when the candidate is not unique
 */
public record UniquenessCheck(boolean unique,
                              boolean exactDuplicate,
                              double maxSimilarity,
                              List<SimilarityConflict> conflicts,
                              boolean componentReuse,
                              boolean patternOverused,
                              PatternType patternType,
                              String fingerprint,
                              double uniquenessScore,
                              List<String> notes) {

    public UniquenessCheck {
        conflicts = List.copyOf(conflicts);
        notes = List.copyOf(notes);
    }
}
