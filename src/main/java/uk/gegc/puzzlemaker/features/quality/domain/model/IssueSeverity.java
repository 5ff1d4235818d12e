package uk.gegc.puzzlemaker.features.quality.domain.model;

public enum IssueSeverity {
    CRITICAL(40),
    MAJOR(20),
    MINOR(5);

    private final int penalty;

    IssueSeverity(int penalty) {
        this.penalty = penalty;
    }

    public int penalty() {
        return penalty;
    }
}
