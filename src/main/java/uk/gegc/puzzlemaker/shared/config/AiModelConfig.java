package uk.gegc.puzzlemaker.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Model chains per capability tier plus per-call defaults.
 */
@Component
@ConfigurationProperties(prefix = "puzzle.ai.models")
@Data
public class AiModelConfig {

    private TierModels fast = new TierModels("gpt-4o-mini", List.of("gpt-4.1-nano"));
    private TierModels balanced = new TierModels("gpt-4.1-mini", List.of("gpt-4o-mini", "gpt-4.1-nano"));
    private TierModels highCapability = new TierModels("gpt-4.1", List.of("gpt-4o", "gpt-4.1-mini"));

    /**
     * Hard per-call timeout; a timed out call counts as a transient failure
     */
    private long timeoutMs = 30000;

    private Temperatures temperature = new Temperatures();

    /**
     * Primary model first, then fallbacks in order, without duplicates or blanks.
     */
    public List<String> chainFor(CapabilityTier tier) {
        TierModels models = switch (tier) {
            case FAST -> fast;
            case BALANCED -> balanced;
            case HIGH_CAPABILITY -> highCapability;
        };
        Set<String> chain = new LinkedHashSet<>();
        if (models != null) {
            addIfPresent(chain, models.getPrimary());
            if (models.getFallbacks() != null) {
                models.getFallbacks().forEach(model -> addIfPresent(chain, model));
            }
        }
        return List.copyOf(chain);
    }

    private static void addIfPresent(Set<String> chain, String model) {
        if (model != null && !model.isBlank()) {
            chain.add(model.trim());
        }
    }

    @Data
    public static class TierModels {
        private String primary;
        private List<String> fallbacks = new ArrayList<>();

        public TierModels() {
        }

        public TierModels(String primary, List<String> fallbacks) {
            this.primary = primary;
            this.fallbacks = new ArrayList<>(fallbacks);
        }
    }

    @Data
    public static class Temperatures {
        private double factual = 0.3;
        private double balanced = 0.7;
        private double creative = 0.9;
    }
}
