package uk.gegc.puzzlemaker.shared.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

@Component
@ConfigurationProperties(prefix = "puzzle.generation")
@Validated
@Data
public class GenerationConfig {

    @Min(1)
    private int maxAttempts = 3;

    private PuzzleType defaultPuzzleType = PuzzleType.REBUS;

    private CapabilityTier defaultTier = CapabilityTier.BALANCED;

    /**
     * Tier used from the second attempt on when {@code escalateTier} is set
     */
    private CapabilityTier escalationTier = CapabilityTier.HIGH_CAPABILITY;
    private boolean escalateTier = true;

    /**
     * Added to the balanced temperature per attempt when novelty is required, capped at the creative one
     */
    private double noveltyTemperatureStep = 0.1;

    @Min(1)
    private int minHints = 3;
    @Max(10)
    private int maxHints = 5;
    private int maxAnswerLength = 50;

    /**
     * Recent answers quoted in the prompt so the model avoids them
     */
    private int recentAnswersInPrompt = 20;

    @Min(1)
    private int batchConcurrency = 2;
    @Min(1)
    private int batchMaxAttempts = 2;
}
