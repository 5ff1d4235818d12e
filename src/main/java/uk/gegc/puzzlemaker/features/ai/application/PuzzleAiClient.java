package uk.gegc.puzzlemaker.features.ai.application;

import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.ai.domain.model.GeneratedCandidate;
import uk.gegc.puzzlemaker.features.ai.domain.model.GenerationSpec;

import java.util.List;

/**
 * Client for generating puzzle candidates through an ordered chain of models.
 */
public interface PuzzleAiClient {

    /**
     * Generates one candidate, falling back through the tier's model chain.
     *
     * @throws uk.gegc.puzzlemaker.shared.exception.AiServiceException      when every model failed or a fatal error occurred
     * @throws uk.gegc.puzzlemaker.shared.exception.AIResponseParseException when the model output is not a candidate
     */
    GeneratedCandidate generate(GenerationSpec spec);

    /**
     * Models tried for a tier, primary first.
     */
    List<String> modelChain(CapabilityTier tier);
}
