package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Model-reported sub-factor scores, each an integer in [1,10].
 */
public record ComplexityProfile(Map<String, Integer> scores) {

    public static final int MIN_SCORE = 1;
    public static final int MAX_SCORE = 10;

    private static final ComplexityProfile EMPTY = new ComplexityProfile(Map.of());

    public ComplexityProfile {
        scores = scores == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public static ComplexityProfile empty() {
        return EMPTY;
    }

    /**
     * Builds a profile from loosely typed values: numbers are rounded and clamped,
     * anything non-numeric or non-finite is dropped.
     */
    public static ComplexityProfile coerce(Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return EMPTY;
        }
        Map<String, Integer> coerced = new LinkedHashMap<>();
        raw.forEach((name, value) -> {
            if (name == null || !(value instanceof Number number)) {
                return;
            }
            double d = number.doubleValue();
            if (Double.isFinite(d)) {
                coerced.put(name, clampScore(d));
            }
        });
        return coerced.isEmpty() ? EMPTY : new ComplexityProfile(coerced);
    }

    public static int clampScore(double value) {
        long rounded = Math.round(value);
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, rounded));
    }

    public OptionalInt get(String factor) {
        Integer value = scores.get(factor);
        return value == null ? OptionalInt.empty() : OptionalInt.of(value);
    }

    public boolean isEmpty() {
        return scores.isEmpty();
    }
}
