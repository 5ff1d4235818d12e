package uk.gegc.puzzlemaker.features.ai.domain.model;

public enum CapabilityTier {
    FAST,
    BALANCED,
    HIGH_CAPABILITY
}
