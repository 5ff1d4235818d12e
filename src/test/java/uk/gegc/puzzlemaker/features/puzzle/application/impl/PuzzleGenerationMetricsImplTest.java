package uk.gegc.puzzlemaker.features.puzzle.application.impl;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.AcceptanceMode;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PuzzleGenerationMetricsImpl Tests")
class PuzzleGenerationMetricsImplTest {

    private SimpleMeterRegistry registry;
    private PuzzleGenerationMetricsImpl metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PuzzleGenerationMetricsImpl(registry);
    }

    @Test
    @DisplayName("accepted puzzles are counted per mode and timed")
    void recordAccepted() {
        metrics.recordAccepted(AcceptanceMode.PUBLISHED, Duration.ofMillis(1200));
        metrics.recordAccepted(AcceptanceMode.BEST_EFFORT, Duration.ofMillis(800));
        metrics.recordAccepted(AcceptanceMode.BEST_EFFORT, Duration.ofMillis(900));

        assertThat(registry.get("puzzle.generation.accepted").tag("mode", "publish").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("puzzle.generation.accepted").tag("mode", "degraded").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("puzzle.generation.duration").timer().count()).isEqualTo(3);
    }

    @Test
    @DisplayName("attempts, failures, rejections and fallbacks")
    void counters() {
        metrics.recordAttempt();
        metrics.recordAttempt();
        metrics.recordFailure(Duration.ofSeconds(3));
        metrics.recordRejection("duplicate");
        metrics.recordModelFallback(CapabilityTier.HIGH_CAPABILITY);

        assertThat(registry.get("puzzle.generation.attempts").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("puzzle.generation.failed").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("puzzle.generation.rejections").tag("reason", "duplicate").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("puzzle.ai.fallbacks").tag("tier", "high_capability").counter().count())
                .isEqualTo(1.0);
    }
}
