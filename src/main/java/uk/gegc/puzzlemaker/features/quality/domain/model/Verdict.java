package uk.gegc.puzzlemaker.features.quality.domain.model;

public enum Verdict {
    PUBLISH,
    REVISE,
    REJECT
}
