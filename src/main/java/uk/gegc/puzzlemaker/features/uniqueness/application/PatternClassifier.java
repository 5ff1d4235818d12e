package uk.gegc.puzzlemaker.features.uniqueness.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PatternMatch;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PatternType;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PuzzleComponents;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Heuristic classification of the wordplay a puzzle relies on. Heuristics run in a
 * fixed order and the first match becomes the primary pattern.
 */
@Component
@RequiredArgsConstructor
public class PatternClassifier {

    static final double MATCHED_CONFIDENCE = 0.8;
    static final double UNMATCHED_CONFIDENCE = 0.3;

    private static final Pattern PHONETIC_HINT = Pattern.compile("sounds like|phonetic", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGIT = Pattern.compile("\\d");

    private final PuzzleComponentExtractor componentExtractor;

    public PatternMatch classify(PuzzleCandidate candidate) {
        return classify(candidate.content(), candidate.answer(), candidate.explanation());
    }

    public PatternMatch classify(String content, String answer, String explanation) {
        PuzzleComponents components = componentExtractor.extract(content);
        String safeExplanation = explanation == null ? "" : explanation;
        List<PatternType> matched = new ArrayList<>();

        if (components.symbols().size() >= 2 && components.textTokens().isEmpty()) {
            matched.add(PatternType.PURE_SYMBOL_COMPOUND);
        }
        if (!components.numbers().isEmpty() && DIGIT.matcher(safeExplanation).find()) {
            matched.add(PatternType.NUMERIC_WORDPLAY);
        }
        if (!components.arrows().isEmpty()) {
            matched.add(PatternType.POSITIONAL);
        }
        if (PHONETIC_HINT.matcher(safeExplanation).find()) {
            matched.add(PatternType.PHONETIC);
        }
        if (components.textTokens().stream().anyMatch(PatternClassifier::isMixedCase)) {
            matched.add(PatternType.MIXED_CASE);
        }
        if (answer != null && answer.trim().split("\\s+").length > 2) {
            matched.add(PatternType.PHRASE);
        }

        if (matched.isEmpty()) {
            return new PatternMatch(PatternType.UNKNOWN, UNMATCHED_CONFIDENCE, List.of());
        }
        return new PatternMatch(matched.get(0), MATCHED_CONFIDENCE, matched);
    }

    private static boolean isMixedCase(String token) {
        return !token.equals(token.toLowerCase(Locale.ROOT)) && !token.equals(token.toUpperCase(Locale.ROOT));
    }
}
