package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Supported puzzle variants. Each variant knows the JSON field carrying its content,
 * its categories, the complexity factors the calibrator weighs and which factor
 * measures creativity.
 */
public enum PuzzleType {

    REBUS("rebusPuzzle",
            "puzzle-types/rebus.txt",
            List.of("compound_words", "phonetic", "positional", "mathematical", "visual_wordplay",
                    "idioms", "phrases", "lateral_thinking", "multi_layer"),
            List.of(new ComplexityFactor("visualAmbiguity", 0.2),
                    new ComplexityFactor("cognitiveSteps", 0.3),
                    new ComplexityFactor("culturalKnowledge", 0.2),
                    new ComplexityFactor("vocabularyLevel", 0.15),
                    new ComplexityFactor("patternNovelty", 0.15)),
            "patternNovelty",
            true,
            Set.of("idioms", "phrases", "compound_words")),

    WORD_PUZZLE("puzzle",
            "puzzle-types/word-puzzle.txt",
            List.of("anagram", "word_search", "crossword_clue", "word_ladder", "cryptogram"),
            List.of(new ComplexityFactor("wordLength", 0.2),
                    new ComplexityFactor("manipulationComplexity", 0.25),
                    new ComplexityFactor("vocabularyLevel", 0.2),
                    new ComplexityFactor("patternObscurity", 0.2),
                    new ComplexityFactor("cognitiveSteps", 0.15)),
            "patternObscurity",
            false,
            Set.of("crossword_clue", "word_ladder", "anagram"));

    private final String contentField;
    private final String promptTemplate;
    private final List<String> categories;
    private final List<ComplexityFactor> factors;
    private final String creativityFactor;
    private final boolean symbolsRequired;
    private final Set<String> educationalCategories;

    PuzzleType(String contentField,
               String promptTemplate,
               List<String> categories,
               List<ComplexityFactor> factors,
               String creativityFactor,
               boolean symbolsRequired,
               Set<String> educationalCategories) {
        this.contentField = contentField;
        this.promptTemplate = promptTemplate;
        this.categories = categories;
        this.factors = factors;
        this.creativityFactor = creativityFactor;
        this.symbolsRequired = symbolsRequired;
        this.educationalCategories = educationalCategories;
    }

    public String contentField() {
        return contentField;
    }

    public String promptTemplate() {
        return promptTemplate;
    }

    public List<String> categories() {
        return categories;
    }

    public List<ComplexityFactor> factors() {
        return factors;
    }

    public String creativityFactor() {
        return creativityFactor;
    }

    /**
     * Whether the content must contain at least one pictographic or non-word symbol
     */
    public boolean symbolsRequired() {
        return symbolsRequired;
    }

    public boolean isEducationalCategory(String category) {
        return category != null && educationalCategories.contains(category);
    }

    public Map<String, Double> defaultWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        factors.forEach(factor -> weights.put(factor.name(), factor.weight()));
        return weights;
    }
}
