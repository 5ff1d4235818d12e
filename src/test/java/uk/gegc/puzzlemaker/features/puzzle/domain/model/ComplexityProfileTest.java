package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ComplexityProfileTest {

    @Test
    @DisplayName("coerce: rounds, clamps and drops non-numeric values")
    void coerce() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("visualAmbiguity", 0);
        raw.put("cognitiveSteps", 15);
        raw.put("culturalKnowledge", 6.5);
        raw.put("vocabularyLevel", "hard");
        raw.put("patternNovelty", Double.NaN);
        raw.put("wordLength", null);

        ComplexityProfile profile = ComplexityProfile.coerce(raw);

        assertThat(profile.scores()).containsOnly(
                Map.entry("visualAmbiguity", 1),
                Map.entry("cognitiveSteps", 10),
                Map.entry("culturalKnowledge", 7));
        assertThat(profile.get("vocabularyLevel")).isEmpty();
    }

    @Test
    @DisplayName("coerce: nothing usable yields the empty profile")
    void coerce_empty() {
        assertThat(ComplexityProfile.coerce(Map.of("a", "b")).isEmpty()).isTrue();
        assertThat(ComplexityProfile.coerce(null)).isSameAs(ComplexityProfile.empty());
    }
}
