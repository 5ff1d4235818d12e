package uk.gegc.puzzlemaker.features.ai.domain.model;

public record BackendResponse(String content, UsageStats usage, String model) {
}
