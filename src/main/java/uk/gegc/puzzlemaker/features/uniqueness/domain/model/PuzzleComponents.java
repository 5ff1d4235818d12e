package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

import java.util.List;

/**
 * Content broken down into parts.
 *
 * @param symbols    pictographic and other notable non-ASCII symbols, in order of appearance
 * @param numbers    digit runs
 * @param textTokens remaining whitespace-separated tokens, case preserved
 * @param arrows     directional symbols (also present in {@code symbols})
 */
public record PuzzleComponents(List<String> symbols,
                               List<String> numbers,
                               List<String> textTokens,
                               List<String> arrows) {

    public PuzzleComponents {
        symbols = List.copyOf(symbols);
        numbers = List.copyOf(numbers);
        textTokens = List.copyOf(textTokens);
        arrows = List.copyOf(arrows);
    }
}
