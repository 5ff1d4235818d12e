package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import java.util.random.RandomGenerator;

/**
 * Per-item target difficulty across a batch. Every value is clamped to [1,10].
 */
public enum DifficultyProgression {

    CONSTANT {
        @Override
        int raw(int index, int count, int start, RandomGenerator random) {
            return start;
        }
    },
    LINEAR {
        @Override
        int raw(int index, int count, int start, RandomGenerator random) {
            return start + index / 2;
        }
    },
    SINE_WAVE {
        @Override
        int raw(int index, int count, int start, RandomGenerator random) {
            return (int) Math.round(start + 2 * Math.sin((double) index / count * 2 * Math.PI));
        }
    },
    RANDOM {
        @Override
        int raw(int index, int count, int start, RandomGenerator random) {
            return random.nextInt(3) + start - 1;
        }
    };

    public static final int MIN_DIFFICULTY = 1;
    public static final int MAX_DIFFICULTY = 10;

    abstract int raw(int index, int count, int start, RandomGenerator random);

    public int difficultyFor(int index, int count, int start, RandomGenerator random) {
        int value = raw(index, Math.max(1, count), start, random);
        return Math.max(MIN_DIFFICULTY, Math.min(MAX_DIFFICULTY, value));
    }
}
