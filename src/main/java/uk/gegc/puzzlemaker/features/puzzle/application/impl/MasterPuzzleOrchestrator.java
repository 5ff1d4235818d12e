package uk.gegc.puzzlemaker.features.puzzle.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.ai.application.PuzzleAiClient;
import uk.gegc.puzzlemaker.features.ai.application.PuzzlePromptService;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.ai.domain.model.GeneratedCandidate;
import uk.gegc.puzzlemaker.features.ai.domain.model.GenerationSpec;
import uk.gegc.puzzlemaker.features.ai.domain.model.PromptContext;
import uk.gegc.puzzlemaker.features.difficulty.application.DifficultyCalibrator;
import uk.gegc.puzzlemaker.features.difficulty.domain.model.DifficultyCalibration;
import uk.gegc.puzzlemaker.features.puzzle.application.CandidateValidator;
import uk.gegc.puzzlemaker.features.puzzle.application.PuzzleGenerationMetrics;
import uk.gegc.puzzlemaker.features.puzzle.application.PuzzleGenerationService;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.AcceptanceMode;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.GenerationAttempt;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.GenerationResult;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleGenerationRequest;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;
import uk.gegc.puzzlemaker.features.quality.application.QualityEvaluator;
import uk.gegc.puzzlemaker.features.quality.domain.model.EvaluationOptions;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityReport;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityThresholds;
import uk.gegc.puzzlemaker.features.uniqueness.application.UniquenessValidator;
import uk.gegc.puzzlemaker.features.uniqueness.domain.model.UniquenessCheck;
import uk.gegc.puzzlemaker.shared.config.AiModelConfig;
import uk.gegc.puzzlemaker.shared.config.GenerationConfig;
import uk.gegc.puzzlemaker.shared.config.QualityConfig;
import uk.gegc.puzzlemaker.shared.config.UniquenessConfig;
import uk.gegc.puzzlemaker.shared.exception.AIResponseParseException;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;
import uk.gegc.puzzlemaker.shared.exception.PuzzleGenerationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Bounded generate-validate-score loop.
 * <p>
 * Each attempt asks the model chain for a candidate, drops it if it is invalid or a
 * near duplicate of recent history, calibrates its difficulty and scores it. The first
 * attempt that clears its threshold is returned. Otherwise the best scored attempt is
 * kept and returned at the end if it reaches the minimum acceptable score.
 * <p>
 * The first attempt gets a relaxed threshold and, by default, no robustness check.
 * From the second attempt on a high overall score is accepted regardless of verdict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MasterPuzzleOrchestrator implements PuzzleGenerationService {

    private final PuzzleAiClient aiClient;
    private final PuzzlePromptService promptService;
    private final CandidateValidator candidateValidator;
    private final UniquenessValidator uniquenessValidator;
    private final DifficultyCalibrator difficultyCalibrator;
    private final QualityEvaluator qualityEvaluator;
    private final PuzzleGenerationMetrics metrics;
    private final GenerationConfig generationConfig;
    private final QualityConfig qualityConfig;
    private final UniquenessConfig uniquenessConfig;
    private final AiModelConfig modelConfig;
    private final Clock clock;

    @Override
    public GenerationResult generate(PuzzleGenerationRequest request) {
        validateRequest(request);

        PuzzleType puzzleType = request.puzzleType() != null
                ? request.puzzleType()
                : generationConfig.getDefaultPuzzleType();
        int maxAttempts = request.maxAttempts() != null ? request.maxAttempts() : generationConfig.getMaxAttempts();
        QualityThresholds baseThresholds = new QualityThresholds(
                request.qualityThreshold() != null ? request.qualityThreshold() : qualityConfig.getPublishThreshold(),
                qualityConfig.getRevisionThreshold());
        String systemPrompt = promptService.buildSystemPrompt(puzzleType);
        List<String> avoidAnswers = uniquenessValidator.recentAnswers(generationConfig.getRecentAnswersInPrompt());

        Instant start = clock.instant();
        GenerationAttempt best = null;
        List<String> feedback = List.of();
        String lastFailure = "no attempt completed";
        int attemptsUsed = 0;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            attemptsUsed = attempt;
            metrics.recordAttempt();
            Instant attemptStart = clock.instant();
            log.info("Generation attempt {}/{}: type={}, difficulty={}, category={}",
                    attempt, maxAttempts, puzzleType, request.targetDifficulty(), request.category());

            try {
                GenerationSpec spec = buildSpec(request, puzzleType, systemPrompt, attempt, avoidAnswers, feedback);
                GeneratedCandidate generated = aiClient.generate(spec);
                PuzzleCandidate candidate = generated.candidate();

                List<String> violations = candidateValidator.validate(candidate);
                if (!violations.isEmpty()) {
                    log.warn("Attempt {} produced an invalid candidate: {}", attempt, violations);
                    metrics.recordRejection("validation");
                    feedback = violations;
                    lastFailure = "invalid candidate: " + String.join("; ", violations);
                    continue;
                }

                UniquenessCheck uniqueness = uniquenessValidator.validate(candidate);
                if (isRejectedAsDuplicate(uniqueness, request.requireNovelty())) {
                    log.warn("Attempt {} candidate '{}' failed uniqueness (max similarity {}, duplicate={})",
                            attempt, candidate.answer(), uniqueness.maxSimilarity(), uniqueness.exactDuplicate());
                    metrics.recordRejection("duplicate");
                    feedback = uniqueness.notes();
                    lastFailure = "candidate too similar to recent puzzles";
                    continue;
                }

                DifficultyCalibration calibration = difficultyCalibrator.calibrate(candidate);
                QualityThresholds thresholds = attempt == 1
                        ? baseThresholds.relaxedBy(qualityConfig.getFirstAttemptRelief())
                        : baseThresholds;
                boolean runRobustness = !(attempt == 1 && qualityConfig.isSkipRobustnessOnFirstAttempt());
                QualityReport report = qualityEvaluator.evaluate(candidate, calibration.calibratedDifficulty(),
                        new EvaluationOptions(thresholds, runRobustness));

                GenerationAttempt scored = new GenerationAttempt(attempt, candidate, generated.model(), calibration,
                        uniqueness, report, Duration.between(attemptStart, clock.instant()).toMillis());

                AcceptanceMode acceptance = acceptanceFor(report, attempt);
                if (acceptance != null) {
                    return accept(scored, attempt, start, acceptance);
                }

                log.info("Attempt {} scored {} (overall {}, verdict {}), threshold {}",
                        attempt, report.finalScore(), report.overall(), report.verdict(), thresholds.publish());
                if (best == null || scored.finalScore() > best.finalScore()) {
                    best = scored;
                }
                feedback = report.actionItems();
                lastFailure = "quality score " + report.finalScore() + " below threshold " + thresholds.publish();

            } catch (AiServiceException e) {
                if (e.getCode().isFatal()) {
                    log.error("Aborting generation on attempt {}: non-retryable AI error {}", attempt, e.getCode(), e);
                    metrics.recordFailure(elapsed(start));
                    throw e;
                }
                log.warn("Attempt {} failed with AI error {}: {}", attempt, e.getCode(), e.getMessage());
                metrics.recordRejection("backend");
                lastFailure = "AI backend error " + e.getCode();
            } catch (AIResponseParseException e) {
                log.warn("Attempt {} returned an unreadable response: {}", attempt, e.getMessage());
                metrics.recordRejection("parse");
                lastFailure = "unreadable model response";
            } catch (RuntimeException e) {
                log.error("Attempt {} failed unexpectedly", attempt, e);
                metrics.recordRejection("error");
                lastFailure = "unexpected error: " + e.getMessage();
            }
        }

        if (best != null && best.finalScore() >= qualityConfig.getMinimumAcceptableScore()) {
            log.warn("No attempt met the threshold; returning best attempt {} with score {}",
                    best.attemptNumber(), best.finalScore());
            return complete(best, attemptsUsed, start, AcceptanceMode.BEST_EFFORT);
        }

        Integer bestScore = best != null ? best.finalScore() : null;
        Map<String, Integer> breakdown = best != null ? best.qualityReport().breakdown() : Map.of();
        String reason = best != null
                ? "best score " + best.finalScore() + " below minimum acceptable "
                + qualityConfig.getMinimumAcceptableScore()
                : lastFailure;
        log.error("Puzzle generation failed after {} attempts: {} (breakdown {})", attemptsUsed, reason, breakdown);
        metrics.recordFailure(elapsed(start));
        throw new PuzzleGenerationException(reason, bestScore, attemptsUsed, breakdown);
    }

    private AcceptanceMode acceptanceFor(QualityReport report, int attempt) {
        if (report.finalScore() >= report.thresholds().publish() && report.passed()) {
            return AcceptanceMode.PUBLISHED;
        }
        if (attempt >= 2 && report.overall() >= qualityConfig.getHighQualityBypassScore()) {
            return AcceptanceMode.HIGH_QUALITY_BYPASS;
        }
        return null;
    }

    private boolean isRejectedAsDuplicate(UniquenessCheck uniqueness, boolean requireNovelty) {
        if (uniqueness.exactDuplicate()) {
            return true;
        }
        if (!uniqueness.unique() && uniqueness.maxSimilarity() > uniquenessConfig.getRejectionThreshold()) {
            return true;
        }
        return requireNovelty && !uniqueness.unique();
    }

    private GenerationResult accept(GenerationAttempt attempt, int attempts, Instant start, AcceptanceMode mode) {
        log.info("Accepted '{}' on attempt {} ({}): score={}, difficulty={}, model={}",
                attempt.candidate().answer(), attempts, mode, attempt.finalScore(),
                attempt.calibration().calibratedDifficulty(), attempt.model());
        return complete(attempt, attempts, start, mode);
    }

    private GenerationResult complete(GenerationAttempt attempt, int attempts, Instant start, AcceptanceMode mode) {
        Duration elapsed = elapsed(start);
        metrics.recordAccepted(mode, elapsed);
        return GenerationResult.from(attempt, attempts, elapsed.toMillis(), mode);
    }

    private GenerationSpec buildSpec(PuzzleGenerationRequest request,
                                     PuzzleType puzzleType,
                                     String systemPrompt,
                                     int attempt,
                                     List<String> avoidAnswers,
                                     List<String> feedback) {
        PromptContext context = PromptContext.builder()
                .puzzleType(puzzleType)
                .targetDifficulty(request.targetDifficulty())
                .category(request.category())
                .requireNovelty(request.requireNovelty())
                .attemptNumber(attempt)
                .avoidAnswers(avoidAnswers)
                .feedback(feedback)
                .build();

        return GenerationSpec.builder()
                .puzzleType(puzzleType)
                .systemPrompt(systemPrompt)
                .promptPayload(promptService.buildGenerationPrompt(context))
                .temperature(temperatureFor(attempt, request.requireNovelty()))
                .tier(tierFor(attempt))
                .timeoutMs(modelConfig.getTimeoutMs())
                .build();
    }

    double temperatureFor(int attempt, boolean requireNovelty) {
        AiModelConfig.Temperatures temperatures = modelConfig.getTemperature();
        if (!requireNovelty) {
            return temperatures.getBalanced();
        }
        double raised = temperatures.getBalanced() + generationConfig.getNoveltyTemperatureStep() * (attempt - 1);
        return Math.min(temperatures.getCreative(), raised);
    }

    CapabilityTier tierFor(int attempt) {
        return attempt > 1 && generationConfig.isEscalateTier()
                ? generationConfig.getEscalationTier()
                : generationConfig.getDefaultTier();
    }

    private Duration elapsed(Instant start) {
        return Duration.between(start, clock.instant());
    }

    private void validateRequest(PuzzleGenerationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Generation request cannot be null");
        }
        if (request.targetDifficulty() < 1 || request.targetDifficulty() > 10) {
            throw new IllegalArgumentException("Target difficulty must be between 1 and 10");
        }
        if (request.maxAttempts() != null && request.maxAttempts() < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1");
        }
        if (request.qualityThreshold() != null
                && (request.qualityThreshold() < 0 || request.qualityThreshold() > 100)) {
            throw new IllegalArgumentException("Quality threshold must be between 0 and 100");
        }
    }
}
