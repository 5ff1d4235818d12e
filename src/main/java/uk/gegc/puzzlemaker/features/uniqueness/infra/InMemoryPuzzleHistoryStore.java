package uk.gegc.puzzlemaker.features.uniqueness.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PersistedPuzzleSummary;
import uk.gegc.puzzlemaker.features.uniqueness.domain.repository.PuzzleHistoryStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
@Slf4j
public class InMemoryPuzzleHistoryStore implements PuzzleHistoryStore {

    private final List<PersistedPuzzleSummary> puzzles = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public InMemoryPuzzleHistoryStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<PersistedPuzzleSummary> queryRecent(int windowDays, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        return puzzles.stream()
                .filter(p -> p.createdAt() != null && !p.createdAt().isBefore(cutoff))
                .sorted(Comparator.comparing(PersistedPuzzleSummary::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void save(PersistedPuzzleSummary summary) {
        if (summary == null) {
            throw new IllegalArgumentException("Puzzle summary must not be null");
        }
        PersistedPuzzleSummary stored = summary.createdAt() != null
                ? summary
                : new PersistedPuzzleSummary(summary.id(), summary.content(), summary.answer(),
                summary.explanation(), summary.category(), summary.fingerprint(), summary.symbols(),
                clock.instant());
        puzzles.add(stored);
        log.debug("Stored puzzle {} in history ({} total)", stored.id(), puzzles.size());
    }
}
