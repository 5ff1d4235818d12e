package uk.gegc.puzzlemaker.features.difficulty.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.difficulty.domain.model.DifficultyCalibration;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.ComplexityProfile;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;
import uk.gegc.puzzlemaker.shared.config.DifficultyConfig;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Turns a complexity profile into a single difficulty inside the configured band.
 * The result never leaves the band, whatever the profile contains.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DifficultyCalibrator {

    private final DifficultyConfig config;

    public DifficultyCalibration calibrate(PuzzleCandidate candidate) {
        ComplexityProfile profile = candidate.complexity();
        Map<String, Double> weights = weightsFor(candidate.type());
        // a profile naming none of the weighted factors carries no signal
        boolean profileUsed = !profile.isEmpty() && matchedWeight(profile, weights) > 0.0;
        double raw = profileUsed
                ? weightedScore(profile, weights)
                : estimateWithoutProfile(candidate);
        int calibrated = clamp(raw);

        if (!profileUsed) {
            log.debug("No usable complexity profile for '{}' (factors {}), heuristic estimate {}",
                    candidate.answer(), profile.scores().keySet(), raw);
        }
        return new DifficultyCalibration(calibrated, candidate.proposedDifficulty(), raw, profileUsed,
                recommendation(candidate.proposedDifficulty(), calibrated));
    }

    /**
     * Sum of factor value times weight over the factors present in the profile, rounded and clamped.
     * Factors without a weight contribute nothing.
     */
    public int calibrate(ComplexityProfile profile, Map<String, Double> weights) {
        return clamp(weightedScore(profile, weights));
    }

    public Map<String, Double> weightsFor(PuzzleType type) {
        Map<String, Double> weights = type.defaultWeights();
        if (config.getWeights() != null) {
            weights.putAll(config.getWeights());
        }
        return weights;
    }

    public int clamp(double raw) {
        long rounded = Double.isFinite(raw) ? Math.round(raw) : config.getMinDifficulty();
        return (int) Math.max(config.getMinDifficulty(), Math.min(config.getMaxDifficulty(), rounded));
    }

    double weightedScore(ComplexityProfile profile, Map<String, Double> weights) {
        double score = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            OptionalInt value = profile.get(weight.getKey());
            if (value.isPresent() && weight.getValue() != null) {
                score += value.getAsInt() * weight.getValue();
            }
        }
        return score;
    }

    double matchedWeight(ComplexityProfile profile, Map<String, Double> weights) {
        double matched = 0.0;
        for (Map.Entry<String, Double> weight : weights.entrySet()) {
            if (profile.get(weight.getKey()).isPresent() && weight.getValue() != null && weight.getValue() > 0.0) {
                matched += weight.getValue();
            }
        }
        return matched;
    }

    /**
     * Answer length per difficulty point times the category multiplier, averaged with the
     * model's own claim when there is one.
     */
    double estimateWithoutProfile(PuzzleCandidate candidate) {
        String answer = candidate.answer() == null ? "" : candidate.answer().trim();
        String category = candidate.category() == null ? "" : candidate.category().toLowerCase(Locale.ROOT);
        double multiplier = config.getCategoryMultipliers().getOrDefault(category, 1.0);
        double estimate = answer.length() / config.getLengthDivisor() * multiplier;
        if (candidate.proposedDifficulty() != null) {
            estimate = (estimate + candidate.proposedDifficulty()) / 2.0;
        }
        return estimate;
    }

    private String recommendation(Integer proposed, int calibrated) {
        if (proposed == null) {
            return DifficultyCalibration.NOT_PROPOSED;
        }
        int delta = Math.abs(proposed - calibrated);
        if (delta > config.getMismatchTolerance()) {
            return DifficultyCalibration.MISMATCH;
        }
        if (delta > config.getMismatchTolerance() - 1) {
            return DifficultyCalibration.MINOR_ADJUSTMENT;
        }
        return DifficultyCalibration.ACCURATE;
    }
}
