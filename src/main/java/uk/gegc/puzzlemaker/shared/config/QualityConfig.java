package uk.gegc.puzzlemaker.shared.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Quality gate settings. Dimension weights are keyed by dimension name (e.g. {@code visualAppeal}).
 */
@Component
@ConfigurationProperties(prefix = "puzzle.quality")
@Validated
@Data
public class QualityConfig {

    private Map<String, @DecimalMin("0.0") Double> weights = new HashMap<>(Map.of(
            "clarity", 0.15,
            "creativity", 0.2,
            "solvability", 0.2,
            "appropriateness", 0.1,
            "visualAppeal", 0.15,
            "educationalValue", 0.1,
            "funFactor", 0.1));

    @Min(0)
    @Max(100)
    private int publishThreshold = 70;
    @Min(0)
    @Max(100)
    private int revisionThreshold = 60;
    @Min(0)
    @Max(100)
    private int minimumAcceptableScore = 55;

    /**
     * Overall score that is accepted from the second attempt on regardless of verdict
     */
    @Min(0)
    @Max(100)
    private int highQualityBypassScore = 70;

    @Min(0)
    @Max(100)
    private int firstAttemptRelief = 10;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double robustnessWeight = 0.3;
    private boolean skipRobustnessOnFirstAttempt = true;

    /**
     * Dimensions scoring below this produce an action item
     */
    @Min(0)
    @Max(100)
    private int actionItemThreshold = 70;
    @Min(0)
    private int maxActionItems = 5;

    private List<String> blockedTerms = new ArrayList<>();

    @AssertTrue(message = "at least one quality dimension must carry weight")
    public boolean isWeighted() {
        return weights != null && weights.values().stream().anyMatch(weight -> weight != null && weight > 0.0);
    }
}
