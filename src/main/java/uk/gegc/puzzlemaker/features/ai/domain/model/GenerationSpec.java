package uk.gegc.puzzlemaker.features.ai.domain.model;

import lombok.Builder;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

/**
 * Everything needed to ask the model chain for one candidate.
 *
 * @param timeoutMs hard per-call timeout for each model in the chain
 */
@Builder
public record GenerationSpec(PuzzleType puzzleType,
                             String systemPrompt,
                             String promptPayload,
                             double temperature,
                             CapabilityTier tier,
                             long timeoutMs) {
}
