package uk.gegc.puzzlemaker.features.puzzle.domain.model;

import java.util.List;

/**
 * @param distinctPatterns number of different pattern types among the successful results
 */
public record BatchGenerationResult(List<GenerationResult> results,
                                    List<BatchItemFailure> failures,
                                    int distinctPatterns) {

    public BatchGenerationResult {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public int requested() {
        return results.size() + failures.size();
    }
}
