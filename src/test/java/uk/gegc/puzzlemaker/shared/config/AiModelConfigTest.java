package uk.gegc.puzzlemaker.shared.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

class AiModelConfigTest {

    @Test
    @DisplayName("chainFor: primary first, trimmed, without duplicates or blanks")
    void chainFor_dedupes() {
        AiModelConfig config = new AiModelConfig();
        config.setFast(new AiModelConfig.TierModels(" gpt-4o-mini ", Arrays.asList("gpt-4.1-nano", null, "", "gpt-4o-mini")));

        assertThat(config.chainFor(CapabilityTier.FAST)).containsExactly("gpt-4o-mini", "gpt-4.1-nano");
    }

    @Test
    @DisplayName("chainFor: missing tier yields an empty chain")
    void chainFor_missingTier() {
        AiModelConfig config = new AiModelConfig();
        config.setHighCapability(null);

        assertThat(config.chainFor(CapabilityTier.HIGH_CAPABILITY)).isEmpty();
        assertThat(config.chainFor(CapabilityTier.BALANCED)).isNotEmpty().doesNotHaveDuplicates();
    }
}
