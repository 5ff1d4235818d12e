package uk.gegc.puzzlemaker.features.puzzle.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.puzzle.application.PuzzleGenerationMetrics;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.AcceptanceMode;

import java.time.Duration;
import java.util.Locale;

/**
 * Micrometer-backed pipeline metrics.
 */
@Slf4j
@Service
public class PuzzleGenerationMetricsImpl implements PuzzleGenerationMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter attemptsCounter;
    private final Counter failedCounter;
    private final Timer durationTimer;

    public PuzzleGenerationMetricsImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.attemptsCounter = Counter.builder("puzzle.generation.attempts")
                .description("Number of generation attempts started")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("puzzle.generation.failed")
                .description("Number of generation requests that produced no acceptable puzzle")
                .register(meterRegistry);
        this.durationTimer = Timer.builder("puzzle.generation.duration")
                .description("Wall time of a full generation request")
                .register(meterRegistry);
    }

    @Override
    public void recordAttempt() {
        attemptsCounter.increment();
    }

    @Override
    public void recordAccepted(AcceptanceMode mode, Duration elapsed) {
        Counter.builder("puzzle.generation.accepted")
                .description("Number of accepted puzzles by acceptance mode")
                .tag("mode", modeTag(mode))
                .register(meterRegistry)
                .increment();
        durationTimer.record(elapsed);
    }

    @Override
    public void recordFailure(Duration elapsed) {
        failedCounter.increment();
        durationTimer.record(elapsed);
    }

    @Override
    public void recordRejection(String reason) {
        Counter.builder("puzzle.generation.rejections")
                .description("Number of attempts rejected before scoring")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordModelFallback(CapabilityTier tier) {
        Counter.builder("puzzle.ai.fallbacks")
                .description("Number of times the next model in a chain was tried")
                .tag("tier", tier.name().toLowerCase(Locale.ROOT))
                .register(meterRegistry)
                .increment();
    }

    private static String modeTag(AcceptanceMode mode) {
        return switch (mode) {
            case PUBLISHED -> "publish";
            case HIGH_QUALITY_BYPASS -> "bypass";
            case BEST_EFFORT -> "degraded";
        };
    }
}
