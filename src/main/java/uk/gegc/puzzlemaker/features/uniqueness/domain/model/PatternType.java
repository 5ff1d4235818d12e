package uk.gegc.puzzlemaker.features.uniqueness.domain.model;

public enum PatternType {
    PURE_SYMBOL_COMPOUND("pure_symbol_compound"),
    NUMERIC_WORDPLAY("numeric_wordplay"),
    POSITIONAL("positional"),
    PHONETIC("phonetic"),
    MIXED_CASE("mixed_case"),
    PHRASE("phrase"),
    UNKNOWN("unknown");

    private final String key;

    PatternType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
