package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.Set;

/**
 * Read-only view of a previously published puzzle.
 *
 * @param fingerprint may be null for legacy rows; recomputed on demand
 * @param symbols     may be null; extracted from content on demand
 */
@Builder
public record PersistedPuzzleSummary(String id,
                                     String content,
                                     String answer,
                                     String explanation,
                                     String category,
                                     String fingerprint,
                                     Set<String> symbols,
                                     Instant createdAt) {
}
