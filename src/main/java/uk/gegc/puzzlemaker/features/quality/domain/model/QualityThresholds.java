package uk.gegc.puzzlemaker.features.quality.domain.model;

/**
 * Score cut-offs for the verdict. {@code publish} is never below {@code revision}.
 */
public record QualityThresholds(int publish, int revision) {

    public QualityThresholds {
        if (revision > publish) {
            revision = publish;
        }
    }

    /**
     * Non-decreasing in score: a higher score never gets a worse verdict.
     */
    public Verdict verdictFor(int score) {
        if (score >= publish) {
            return Verdict.PUBLISH;
        }
        if (score >= revision) {
            return Verdict.REVISE;
        }
        return Verdict.REJECT;
    }

    /**
     * Publish bar lowered by {@code points} but not below the revision bar.
     */
    public QualityThresholds relaxedBy(int points) {
        return new QualityThresholds(Math.max(revision, publish - points), revision);
    }
}
