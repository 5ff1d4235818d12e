package uk.gegc.puzzlemaker.features.uniqueness.application;

import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.PuzzleComponents;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits puzzle content into symbols, numbers, text tokens and arrows.
 * <p>
 * A notable symbol is any non-ASCII code point of Unicode category So or Sm, or any arrow.
 * Variation selectors, joiners, keycap marks and skin-tone modifiers are dropped.
 */
@Component
public class PuzzleComponentExtractor {

    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<Character.UnicodeBlock> ARROW_BLOCKS = Set.of(
            Character.UnicodeBlock.ARROWS,
            Character.UnicodeBlock.SUPPLEMENTAL_ARROWS_A,
            Character.UnicodeBlock.SUPPLEMENTAL_ARROWS_B,
            Character.UnicodeBlock.SUPPLEMENTAL_ARROWS_C);

    private static final Set<Integer> EXTRA_ARROWS = Set.of(
            0x27A1, 0x2B05, 0x2B06, 0x2B07, 0x2934, 0x2935,
            0x23E9, 0x23EA, 0x23EB, 0x23EC,
            0x1F519, 0x1F51A, 0x1F51B, 0x1F51C, 0x1F51D);

    public PuzzleComponents extract(String content) {
        if (content == null || content.isEmpty()) {
            return new PuzzleComponents(List.of(), List.of(), List.of(), List.of());
        }

        List<String> symbols = new ArrayList<>();
        List<String> arrows = new ArrayList<>();
        StringBuilder text = new StringBuilder(content.length());

        content.codePoints().forEach(cp -> {
            if (isModifier(cp)) {
                return;
            }
            if (isNotableSymbol(cp)) {
                String symbol = new String(Character.toChars(cp));
                symbols.add(symbol);
                if (isArrow(cp)) {
                    arrows.add(symbol);
                }
                text.append(' ');
            } else {
                text.appendCodePoint(cp);
            }
        });

        List<String> numbers = new ArrayList<>();
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            numbers.add(matcher.group());
        }

        List<String> tokens = new ArrayList<>();
        for (String token : WHITESPACE.split(text.toString().trim())) {
            if (!token.isEmpty() && !NUMBER.matcher(token).matches()) {
                tokens.add(token);
            }
        }

        return new PuzzleComponents(symbols, numbers, tokens, arrows);
    }

    /**
     * Distinct notable symbols in code point order.
     */
    public SortedSet<String> notableSymbols(String content) {
        return new TreeSet<>(extract(content).symbols());
    }

    public boolean containsNotableSymbol(String content) {
        return content != null && content.codePoints().anyMatch(cp -> !isModifier(cp) && isNotableSymbol(cp));
    }

    static boolean isNotableSymbol(int cp) {
        if (cp <= 0x7F) {
            return false;
        }
        int type = Character.getType(cp);
        return type == Character.OTHER_SYMBOL || type == Character.MATH_SYMBOL || isArrow(cp);
    }

    static boolean isArrow(int cp) {
        return EXTRA_ARROWS.contains(cp) || ARROW_BLOCKS.contains(Character.UnicodeBlock.of(cp));
    }

    private static boolean isModifier(int cp) {
        return cp == 0xFE0F || cp == 0xFE0E || cp == 0x200D || cp == 0x20E3
                || (cp >= 0x1F3FB && cp <= 0x1F3FF);
    }
}
