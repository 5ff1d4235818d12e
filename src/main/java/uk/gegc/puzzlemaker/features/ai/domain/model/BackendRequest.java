package uk.gegc.puzzlemaker.features.ai.domain.model;

/**
 * A single call against one concrete model.
 */
public record BackendRequest(String model,
                             String systemPrompt,
                             String promptPayload,
                             double temperature,
                             CapabilityTier tier,
                             long timeoutMs) {

    public static BackendRequest forModel(String model, GenerationSpec spec) {
        return new BackendRequest(model, spec.systemPrompt(), spec.promptPayload(), spec.temperature(),
                spec.tier(), spec.timeoutMs());
    }
}
