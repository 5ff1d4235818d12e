package uk.gegc.puzzlemaker.features.puzzle.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;
import uk.gegc.puzzlemaker.features.uniqueness.application.PuzzleComponentExtractor;
import uk.gegc.puzzlemaker.shared.config.GenerationConfig;
import uk.gegc.puzzlemaker.support.PuzzleFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CandidateValidator Tests")
class CandidateValidatorTest {

    private static final List<String> HINTS = List.of("One", "Two", "Three");

    private CandidateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CandidateValidator(new GenerationConfig(), new PuzzleComponentExtractor());
    }

    private static PuzzleCandidate rebus(String content, String answer, List<String> hints) {
        return new PuzzleCandidate(PuzzleType.REBUS, content, answer, "Explained", hints, "phonetic", 4, null);
    }

    @Test
    @DisplayName("validate: complete rebus has no violations")
    void validate_valid() {
        assertThat(validator.validate(PuzzleFixtures.sunflower())).isEmpty();
    }

    @Test
    @DisplayName("validate: every missing field is reported")
    void validate_missingFields() {
        PuzzleCandidate empty = new PuzzleCandidate(PuzzleType.REBUS, null, " ", null, HINTS, null, null, null);

        assertThat(validator.validate(empty)).containsExactly(
                "Missing required field: rebusPuzzle",
                "Missing required field: answer",
                "Missing required field: explanation",
                "Missing required field: category",
                "Missing required field: difficulty");
    }

    @Test
    @DisplayName("validate: rebus made only of letters is rejected")
    void validate_rebusWithoutSymbols() {
        assertThat(validator.validate(rebus("SUN FLOWER", "sunflower", HINTS)))
                .containsExactly("rebusPuzzle must contain at least one emoji or symbol");
    }

    @Test
    @DisplayName("validate: ASCII punctuation counts as a symbol")
    void validate_asciiSymbol() {
        assertThat(validator.validate(rebus("MIND / MATTER", "mind over matter", HINTS))).isEmpty();
    }

    @Test
    @DisplayName("validate: word puzzle content needs no symbols")
    void validate_wordPuzzle() {
        PuzzleCandidate word = new PuzzleCandidate(PuzzleType.WORD_PUZZLE, "TSIL", "list", "Reversed", HINTS,
                "anagram", 2, null);

        assertThat(validator.validate(word)).isEmpty();
    }

    @Test
    @DisplayName("validate: answer longer than 50 characters")
    void validate_longAnswer() {
        assertThat(validator.validate(rebus("☀️", "a".repeat(51), HINTS)))
                .containsExactly("Answer must be at most 50 characters");
    }

    @Test
    @DisplayName("validate: hint count outside 3-5 and blank hints")
    void validate_hints() {
        assertThat(validator.validate(rebus("☀️", "sun", List.of("a", "b"))))
                .containsExactly("Expected 3 to 5 hints but got 2");
        assertThat(validator.validate(rebus("☀️", "sun", List.of("a", "b", "c", "d", "e", "f"))))
                .containsExactly("Expected 3 to 5 hints but got 6");
        assertThat(validator.validate(rebus("☀️", "sun", List.of("a", " ", "c"))))
                .containsExactly("Hints must not be blank");
    }
}
