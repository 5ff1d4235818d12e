package uk.gegc.puzzlemaker.features.ai.domain.model;

public record UsageStats(long promptTokens, long completionTokens, long totalTokens) {

    private static final UsageStats EMPTY = new UsageStats(0, 0, 0);

    public static UsageStats empty() {
        return EMPTY;
    }
}
