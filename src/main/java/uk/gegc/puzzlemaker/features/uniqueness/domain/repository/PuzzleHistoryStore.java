package uk.gegc.puzzlemaker.features.uniqueness.domain.repository;

import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PersistedPuzzleSummary;

import java.util.List;

/**
 * Source of previously published puzzles.
 */
public interface PuzzleHistoryStore {

    /**
     * Puzzles created within the last {@code windowDays}, newest first, at most {@code limit}.
     */
    List<PersistedPuzzleSummary> queryRecent(int windowDays, int limit);

    void save(PersistedPuzzleSummary summary);
}
