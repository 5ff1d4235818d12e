package uk.gegc.puzzlemaker.shared.config;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Backoff settings applied once the model chain has been exhausted with a transient error.
 * Quota exhaustion is never retried here.
 */
@Component
@ConfigurationProperties(prefix = "puzzle.ai.retry")
@Validated
@Data
public class AiRateLimitConfig {

    /**
     * Total attempts including the first call
     */
    @Min(1)
    private int maxAttempts = 3;

    /**
     * Delay before the second attempt
     */
    @Min(0)
    private long baseDelayMs = 1000;

    @DecimalMin("1.0")
    private double multiplier = 2.0;

    /**
     * Cap for the exponential delay
     */
    @Min(0)
    private long maxDelayMs = 10000;

    /**
     * 0.0 = deterministic delays, 0.5 = +/-50% variation
     */
    @DecimalMin("0.0")
    private double jitterFactor = 0.0;
}
