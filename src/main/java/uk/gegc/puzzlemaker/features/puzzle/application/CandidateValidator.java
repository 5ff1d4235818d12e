package uk.gegc.puzzlemaker.features.puzzle.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.uniqueness.application.PuzzleComponentExtractor;
import uk.gegc.puzzlemaker.shared.config.GenerationConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Structural checks on a parsed candidate. Returns the violations, empty when valid.
 */
@Component
@RequiredArgsConstructor
public class CandidateValidator {

    private static final Pattern NON_WORD_SYMBOL = Pattern.compile("[^\\w\\s]");

    private final GenerationConfig config;
    private final PuzzleComponentExtractor componentExtractor;

    public List<String> validate(PuzzleCandidate candidate) {
        List<String> violations = new ArrayList<>();
        String field = candidate.type().contentField();

        if (isBlank(candidate.content())) {
            violations.add("Missing required field: " + field);
        } else if (candidate.type().symbolsRequired()
                && !componentExtractor.containsNotableSymbol(candidate.content())
                && !NON_WORD_SYMBOL.matcher(candidate.content()).find()) {
            violations.add(field + " must contain at least one emoji or symbol");
        }

        if (isBlank(candidate.answer())) {
            violations.add("Missing required field: answer");
        } else if (candidate.answer().trim().length() > config.getMaxAnswerLength()) {
            violations.add("Answer must be at most " + config.getMaxAnswerLength() + " characters");
        }

        if (isBlank(candidate.explanation())) {
            violations.add("Missing required field: explanation");
        }
        if (isBlank(candidate.category())) {
            violations.add("Missing required field: category");
        }
        if (candidate.proposedDifficulty() == null) {
            violations.add("Missing required field: difficulty");
        }

        int hints = candidate.hints().size();
        if (hints < config.getMinHints() || hints > config.getMaxHints()) {
            violations.add(String.format("Expected %d to %d hints but got %d",
                    config.getMinHints(), config.getMaxHints(), hints));
        } else if (candidate.hints().stream().anyMatch(CandidateValidator::isBlank)) {
            violations.add("Hints must not be blank");
        }

        return violations;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
