package uk.gegc.puzzlemaker.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.ai.application.GenerativeBackend;
import uk.gegc.puzzlemaker.features.ai.application.PuzzleAiClient;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendRequest;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendResponse;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.ai.domain.model.GeneratedCandidate;
import uk.gegc.puzzlemaker.features.ai.domain.model.GenerationSpec;
import uk.gegc.puzzlemaker.features.ai.infra.AiErrorClassifier;
import uk.gegc.puzzlemaker.features.ai.infra.parser.PuzzleCandidateParser;
import uk.gegc.puzzlemaker.features.puzzle.application.PuzzleGenerationMetrics;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.shared.config.AiModelConfig;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.util.List;

/**
 * Tries the tier's models in order. A model-not-found, quota, rate-limit, gateway,
 * unavailable or timeout failure moves on to the next model; any other failure is
 * rethrown at once. When the whole chain fails transiently it is retried with backoff.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ModelFallbackPuzzleClient implements PuzzleAiClient {

    private final GenerativeBackend backend;
    private final AiModelConfig modelConfig;
    private final AiErrorClassifier errorClassifier;
    private final AiRetryExecutor retryExecutor;
    private final PuzzleCandidateParser candidateParser;
    private final PuzzleGenerationMetrics metrics;

    @Override
    public GeneratedCandidate generate(GenerationSpec spec) {
        validateSpec(spec);
        BackendResponse response = retryExecutor.withRetry(() -> invokeChain(spec));
        PuzzleCandidate candidate = candidateParser.parse(response.content(), spec.puzzleType());
        return new GeneratedCandidate(candidate, response.model(), response.usage());
    }

    @Override
    public List<String> modelChain(CapabilityTier tier) {
        return modelConfig.chainFor(tier);
    }

    BackendResponse invokeChain(GenerationSpec spec) {
        List<String> models = modelChain(spec.tier());
        if (models.isEmpty()) {
            throw new AiServiceException("No models configured for tier " + spec.tier(), AiErrorCode.INVALID_REQUEST);
        }

        AiServiceException lastError = null;
        for (int i = 0; i < models.size(); i++) {
            String model = models.get(i);
            try {
                BackendResponse response = backend.invoke(BackendRequest.forModel(model, spec));
                if (i > 0) {
                    log.info("Generated with fallback model {} (position {} in {} chain)", model, i + 1, spec.tier());
                } else {
                    log.debug("Generated with primary model {}", model);
                }
                return new BackendResponse(response.content(), response.usage(), model);
            } catch (RuntimeException e) {
                AiServiceException classified = errorClassifier.classify(e);
                if (!classified.getCode().isFallbackEligible()) {
                    log.error("Model {} failed with non-retryable error {}: {}",
                            model, classified.getCode(), e.getMessage());
                    throw classified;
                }
                lastError = classified;
                if (i < models.size() - 1) {
                    log.warn("Model {} failed with {} ({}). Trying {}",
                            model, classified.getCode(), e.getMessage(), models.get(i + 1));
                    metrics.recordModelFallback(spec.tier());
                }
            }
        }

        log.error("All {} models for tier {} failed; last error {}", models.size(), spec.tier(), lastError.getCode());
        throw lastError;
    }

    private void validateSpec(GenerationSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Generation spec cannot be null");
        }
        if (spec.puzzleType() == null) {
            throw new IllegalArgumentException("Puzzle type cannot be null");
        }
        if (spec.tier() == null) {
            throw new IllegalArgumentException("Capability tier cannot be null");
        }
        if (spec.promptPayload() == null || spec.promptPayload().isBlank()) {
            throw new IllegalArgumentException("Prompt payload cannot be empty");
        }
    }
}
