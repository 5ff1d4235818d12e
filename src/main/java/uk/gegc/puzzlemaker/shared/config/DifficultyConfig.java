package uk.gegc.puzzlemaker.shared.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.HashMap;
import java.util.Map;

/**
 * Calibration band and weighting overrides.
 * <p>
 * {@code weights} overrides the built-in factor weights of any puzzle type by factor name.
 */
@Component
@ConfigurationProperties(prefix = "puzzle.difficulty")
@Validated
@Data
public class DifficultyConfig {

    @Min(1)
    @Max(10)
    private int minDifficulty = 1;
    @Min(1)
    @Max(10)
    private int maxDifficulty = 10;

    private Map<String, @DecimalMin("0.0") Double> weights = new HashMap<>();

    private Map<String, @DecimalMin(value = "0.0", inclusive = false) Double> categoryMultipliers = new HashMap<>(Map.of(
            "cryptogram", 1.5,
            "multi_layer", 1.3,
            "lateral_thinking", 1.3,
            "idioms", 1.1));

    /**
     * Answer characters per difficulty point for the no-profile estimate
     */
    @DecimalMin(value = "0.0", inclusive = false)
    private double lengthDivisor = 5.0;

    /**
     * Distance between proposed and calibrated difficulty tolerated before a mismatch is reported
     */
    @Min(0)
    private int mismatchTolerance = 2;

    @AssertTrue(message = "minDifficulty must not exceed maxDifficulty")
    public boolean isBandValid() {
        return minDifficulty <= maxDifficulty;
    }
}
