package uk.gegc.puzzlemaker.features.uniqueness.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PatternMatch;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PatternType;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PersistedPuzzleSummary;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.SimilarityConflict;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.UniquenessCheck;
import uk.gegc.puzzlemaker.features.uniqueness.domain.repository.PuzzleHistoryStore;
import uk.gegc.puzzlemaker.shared.config.UniquenessConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compares a candidate with recently published puzzles.
 * <p>
 * An exact fingerprint match short-circuits everything else. Otherwise the candidate is
 * scored against every recent item, its symbol set is checked for reuse and its
 * wordplay pattern for overuse in the shorter diversity window. History is only read.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UniquenessValidator {

    private final PuzzleHistoryStore historyStore;
    private final PuzzleFingerprinter fingerprinter;
    private final SimilarityCalculator similarityCalculator;
    private final PuzzleComponentExtractor componentExtractor;
    private final PatternClassifier patternClassifier;
    private final UniquenessConfig config;

    public UniquenessCheck validate(PuzzleCandidate candidate) {
        String fingerprint = fingerprinter.fingerprint(candidate);
        PatternType pattern = patternClassifier.classify(candidate).primary();
        List<PersistedPuzzleSummary> recent =
                historyStore.queryRecent(config.getWindowDays(), config.getMaxHistoryItems());

        for (PersistedPuzzleSummary previous : recent) {
            if (fingerprint.equals(fingerprintOf(previous))) {
                log.warn("Candidate '{}' duplicates puzzle {}", candidate.answer(), previous.id());
                return new UniquenessCheck(false, true, 1.0,
                        List.of(new SimilarityConflict(previous.id(), previous.answer(), 1.0)),
                        false, false, pattern, fingerprint, 0.0,
                        List.of("Exact duplicate of a recent puzzle; choose a different answer or symbols"));
            }
        }

        Set<String> symbols = componentExtractor.notableSymbols(candidate.content());
        List<SimilarityConflict> conflicts = new ArrayList<>();
        double maxSimilarity = 0.0;
        boolean componentReuse = false;

        for (PersistedPuzzleSummary previous : recent) {
            Set<String> previousSymbols = symbolsOf(previous);
            double similarity = similarityCalculator.similarity(
                    candidate.answer(), symbols, previous.answer(), previousSymbols);
            if (similarity > config.getConflictThreshold()) {
                conflicts.add(new SimilarityConflict(previous.id(), previous.answer(), similarity));
                maxSimilarity = Math.max(maxSimilarity, similarity);
            }
            if (!componentReuse
                    && SimilarityCalculator.jaccard(symbols, previousSymbols) > config.getComponentOverlapThreshold()) {
                componentReuse = true;
            }
        }

        long patternUsage = pattern == PatternType.UNKNOWN ? 0 : countPatternUsage(pattern);
        int maxPatternUsage = (int) Math.ceil(config.getDiversityWindowDays() / 3.0);
        boolean patternOverused = patternUsage > maxPatternUsage;

        boolean similarityConflict = !conflicts.isEmpty() && maxSimilarity > config.getRejectionThreshold();
        boolean unique = !similarityConflict && !componentReuse && !patternOverused;

        List<String> notes = new ArrayList<>();
        if (!conflicts.isEmpty()) {
            notes.add(String.format("Too similar to %d recent puzzle(s) (max similarity %.2f); avoid answers like '%s'",
                    conflicts.size(), maxSimilarity, conflicts.get(0).answer()));
        }
        if (componentReuse) {
            notes.add("Symbol combination was used recently; pick different symbols");
        }
        if (patternOverused) {
            notes.add(String.format("Pattern %s used %d times in the last %d days; try a different style of wordplay",
                    pattern.key(), patternUsage, config.getDiversityWindowDays()));
        }

        double score = unique ? uniquenessScore(maxSimilarity, conflicts.size()) : 0.0;
        log.debug("Uniqueness for '{}': unique={}, conflicts={}, maxSimilarity={}, pattern={}",
                candidate.answer(), unique, conflicts.size(), maxSimilarity, pattern.key());

        return new UniquenessCheck(unique, false, maxSimilarity, conflicts, componentReuse, patternOverused,
                pattern, fingerprint, score, notes);
    }

    /**
     * Answers of recent puzzles, newest first, for the generation prompt's avoid list.
     */
    public List<String> recentAnswers(int limit) {
        return historyStore.queryRecent(config.getWindowDays(), limit).stream()
                .map(PersistedPuzzleSummary::answer)
                .filter(Objects::nonNull)
                .toList();
    }

    static double uniquenessScore(double maxSimilarity, int conflictCount) {
        return Math.max(0.0, 100.0 - maxSimilarity * 30.0 - conflictCount * 10.0);
    }

    private long countPatternUsage(PatternType pattern) {
        return historyStore.queryRecent(config.getDiversityWindowDays(), config.getMaxHistoryItems()).stream()
                .map(previous -> patternClassifier.classify(previous.content(), previous.answer(), previous.explanation()))
                .map(PatternMatch::primary)
                .filter(pattern::equals)
                .count();
    }

    private String fingerprintOf(PersistedPuzzleSummary summary) {
        return summary.fingerprint() != null
                ? summary.fingerprint()
                : fingerprinter.fingerprint(summary.content(), summary.answer(), summary.category());
    }

    private Set<String> symbolsOf(PersistedPuzzleSummary summary) {
        return summary.symbols() != null
                ? summary.symbols()
                : componentExtractor.notableSymbols(summary.content());
    }
}
