package uk.gegc.puzzlemaker.features.puzzle.application;

import uk.gegc.puzzlemaker.features.puzzle.domain.model.GenerationResult;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleGenerationRequest;

/**
 * Entry point of the generation pipeline.
 */
public interface PuzzleGenerationService {

    /**
     * Generates, validates, calibrates and scores candidates until one is acceptable
     * or the attempt budget is spent.
     *
     * @throws uk.gegc.puzzlemaker.shared.exception.PuzzleGenerationException when no acceptable puzzle was produced
     * @throws uk.gegc.puzzlemaker.shared.exception.AiServiceException        on a fatal backend error
     */
    GenerationResult generate(PuzzleGenerationRequest request);
}
