package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;

class DifficultyProgressionTest {

    private final Random random = new Random(7);

    private List<Integer> run(DifficultyProgression progression, int count, int start) {
        return IntStream.range(0, count)
                .map(i -> progression.difficultyFor(i, count, start, random))
                .boxed()
                .toList();
    }

    @Test
    @DisplayName("CONSTANT keeps the start difficulty")
    void constant() {
        assertThat(run(DifficultyProgression.CONSTANT, 3, 6)).containsExactly(6, 6, 6);
    }

    @Test
    @DisplayName("LINEAR rises by one every two items")
    void linear() {
        assertThat(run(DifficultyProgression.LINEAR, 6, 3)).containsExactly(3, 3, 4, 4, 5, 5);
    }

    @Test
    @DisplayName("SINE_WAVE swings two either side of the start")
    void sineWave() {
        assertThat(run(DifficultyProgression.SINE_WAVE, 4, 5)).containsExactly(5, 7, 5, 3);
    }

    @Test
    @DisplayName("RANDOM stays within one of the start")
    void random() {
        assertThat(run(DifficultyProgression.RANDOM, 50, 5)).allSatisfy(d -> assertThat(d).isBetween(4, 6));
    }

    @Test
    @DisplayName("values are clamped to 1-10")
    void clamped() {
        assertThat(run(DifficultyProgression.LINEAR, 6, 9)).containsExactly(9, 9, 10, 10, 10, 10);
        assertThat(run(DifficultyProgression.SINE_WAVE, 4, 1)).containsExactly(1, 3, 1, 1);
        assertThat(run(DifficultyProgression.RANDOM, 20, 1)).allSatisfy(d -> assertThat(d).isBetween(1, 2));
    }
}
