package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import lombok.Builder;

/**
 * @param targetDifficulty desired difficulty on the 1-10 scale
 * @param category         optional category hint, free text
 * @param qualityThreshold overrides the configured publish threshold when set
 * @param maxAttempts      overrides the configured attempt budget when set
 * @param puzzleType       defaults to the configured puzzle type when null
 */
@Builder(toBuilder = true)
public record PuzzleGenerationRequest(int targetDifficulty,
                                      String category,
                                      boolean requireNovelty,
                                      Integer qualityThreshold,
                                      Integer maxAttempts,
                                      PuzzleType puzzleType) {

    public static PuzzleGenerationRequest of(int targetDifficulty) {
        return PuzzleGenerationRequest.builder().targetDifficulty(targetDifficulty).build();
    }
}
