package uk.gegc.puzzlemaker.features.uniqueness.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.shared.config.UniquenessConfig;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Blended similarity in [0,1]: edit-distance similarity of the answers plus
 * Jaccard overlap of the symbol sets, weighted by {@link UniquenessConfig}.
 * Puzzles without notable symbols on either side (word puzzles) are compared by
 * answer alone.
 */
@Component
@RequiredArgsConstructor
public class SimilarityCalculator {

    private final PuzzleComponentExtractor componentExtractor;
    private final UniquenessConfig config;

    public double similarity(PuzzleCandidate a, PuzzleCandidate b) {
        return similarity(a.answer(), componentExtractor.notableSymbols(a.content()),
                b.answer(), componentExtractor.notableSymbols(b.content()));
    }

    public double similarity(String answerA, Set<String> symbolsA, String answerB, Set<String> symbolsB) {
        double label = levenshteinSimilarity(answerA, answerB);
        if (isEmpty(symbolsA) && isEmpty(symbolsB)) {
            return label;
        }
        double symbols = jaccard(symbolsA, symbolsB);
        double blended = label * config.getLabelWeight() + symbols * config.getSymbolWeight();
        return Math.max(0.0, Math.min(1.0, blended));
    }

    private static boolean isEmpty(Set<String> symbols) {
        return symbols == null || symbols.isEmpty();
    }

    /**
     * 1 - distance / longer length, case-insensitive. Two empty strings are identical.
     */
    public static double levenshteinSimilarity(String a, String b) {
        String left = a == null ? "" : a.toLowerCase(Locale.ROOT);
        String right = b == null ? "" : b.toLowerCase(Locale.ROOT);
        String longer = left.length() >= right.length() ? left : right;
        String shorter = longer == left ? right : left;
        if (longer.isEmpty()) {
            return 1.0;
        }
        return (longer.length() - levenshteinDistance(longer, shorter)) / (double) longer.length();
    }

    public static int levenshteinDistance(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }

    /**
     * Intersection over union. Two empty sets share nothing and score 0.
     */
    public static double jaccard(Set<String> a, Set<String> b) {
        Set<String> left = a == null ? Set.of() : a;
        Set<String> right = b == null ? Set.of() : b;
        Set<String> union = new HashSet<>(left);
        union.addAll(right);
        if (union.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(left);
        intersection.retainAll(right);
        return intersection.size() / (double) union.size();
    }
}
