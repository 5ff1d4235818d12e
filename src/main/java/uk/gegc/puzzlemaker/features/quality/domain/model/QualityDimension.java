package uk.gegc.puzzlemaker.features.quality.domain.model;

public enum QualityDimension {

    CLARITY("clarity", "Make the explanation clear and concise (between 20 and 200 characters)"),
    CREATIVITY("creativity", "Use a fresher, less predictable wordplay pattern"),
    SOLVABILITY("solvability", "Add more helpful hints or simplify the puzzle"),
    APPROPRIATENESS("appropriateness", "Remove content that is not suitable for a general audience"),
    VISUAL_APPEAL("visualAppeal", "Use more expressive symbols to build the puzzle"),
    EDUCATIONAL_VALUE("educationalValue", "Prefer idioms, phrases or compound words that teach something"),
    FUN_FACTOR("funFactor", "Aim for a satisfying aha moment with a few reasoning steps");

    private final String key;
    private final String improvementHint;

    QualityDimension(String key, String improvementHint) {
        this.key = key;
        this.improvementHint = improvementHint;
    }

    public String key() {
        return key;
    }

    public String improvementHint() {
        return improvementHint;
    }
}
