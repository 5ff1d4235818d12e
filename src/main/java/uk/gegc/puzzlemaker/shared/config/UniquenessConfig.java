package uk.gegc.puzzlemaker.shared.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "puzzle.uniqueness")
@Validated
@Data
public class UniquenessConfig {

    /**
     * History window used for similarity and component checks
     */
    @Min(1)
    private int windowDays = 30;

    @Min(1)
    private int maxHistoryItems = 100;

    /**
     * Shorter window for pattern overuse
     */
    @Min(1)
    private int diversityWindowDays = 7;

    /**
     * Similarity above which a history item is reported as a conflict
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double conflictThreshold = 0.7;

    /**
     * Similarity above which the orchestrator rejects the candidate outright
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double rejectionThreshold = 0.8;

    /**
     * Symbol-set overlap above which components count as reused
     */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double componentOverlapThreshold = 0.7;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double labelWeight = 0.6;
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double symbolWeight = 0.4;

    @AssertTrue(message = "labelWeight and symbolWeight must not both be zero")
    public boolean isBlendWeighted() {
        return labelWeight + symbolWeight > 0.0;
    }
}
