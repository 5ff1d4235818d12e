package uk.gegc.puzzlemaker.features.quality.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;
import uk.gegc.puzzlemaker.features.quality.domain.model.EvaluationOptions;
import uk.gegc.puzzlemaker.features.quality.domain.model.IssueSeverity;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityDimension;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityReport;
import uk.gegc.puzzlemaker.features.quality.domain.model.QualityThresholds;
import uk.gegc.puzzlemaker.features.quality.domain.model.RobustnessReport;
import uk.gegc.puzzlemaker.features.quality.domain.model.Verdict;
import uk.gegc.puzzlemaker.features.uniqueness.application.PuzzleComponentExtractor;
import uk.gegc.puzzlemaker.shared.config.QualityConfig;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Scores a candidate on every {@link QualityDimension}, aggregates the weighted overall
 * score and turns it into a verdict.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class QualityEvaluator {

    static final int CLEAR_EXPLANATION_SCORE = 80;
    static final int UNCLEAR_EXPLANATION_SCORE = 60;
    static final int DEFAULT_CREATIVITY_SCORE = 50;
    static final int HIGH_VALUE_SCORE = 85;
    static final int STANDARD_VALUE_SCORE = 70;
    static final int TEXT_LAYOUT_VISUAL_SCORE = 75;

    private final QualityConfig config;
    private final RobustnessChecker robustnessChecker;
    private final PuzzleComponentExtractor componentExtractor;

    public QualityThresholds defaultThresholds() {
        return new QualityThresholds(config.getPublishThreshold(), config.getRevisionThreshold());
    }

    public QualityReport evaluate(PuzzleCandidate candidate, int calibratedDifficulty) {
        return evaluate(candidate, calibratedDifficulty, new EvaluationOptions(defaultThresholds(), true));
    }

    public QualityReport evaluate(PuzzleCandidate candidate, int calibratedDifficulty, EvaluationOptions options) {
        Map<QualityDimension, Integer> scores = scoreDimensions(candidate, calibratedDifficulty);
        int overall = aggregate(scores);

        RobustnessReport robustness = options.runRobustness() ? robustnessChecker.check(candidate) : null;
        int finalScore = robustness == null
                ? overall
                : (int) Math.round(overall * (1 - config.getRobustnessWeight())
                + robustness.score() * config.getRobustnessWeight());

        Verdict verdict = options.thresholds().verdictFor(finalScore);
        if (verdict == Verdict.PUBLISH && robustness != null && !robustness.passed()) {
            verdict = Verdict.REVISE;
        }

        List<String> actionItems = actionItems(scores, robustness, verdict);
        log.debug("Quality for '{}': overall={}, final={}, verdict={}",
                candidate.answer(), overall, finalScore, verdict);
        return new QualityReport(scores, overall, finalScore, verdict, actionItems, robustness, options.thresholds());
    }

    public Map<QualityDimension, Integer> scoreDimensions(PuzzleCandidate candidate, int calibratedDifficulty) {
        Map<QualityDimension, Integer> scores = new EnumMap<>(QualityDimension.class);
        for (QualityDimension dimension : QualityDimension.values()) {
            scores.put(dimension, clampScore(score(dimension, candidate, calibratedDifficulty)));
        }
        return scores;
    }

    /**
     * Weighted average over the supplied dimensions. Dimensions without a configured
     * weight count with weight 0; no weight at all yields 0.
     */
    public int aggregate(Map<QualityDimension, Integer> scores) {
        double weighted = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<QualityDimension, Integer> entry : scores.entrySet()) {
            double weight = config.getWeights().getOrDefault(entry.getKey().key(), 0.0);
            weighted += entry.getValue() * weight;
            totalWeight += weight;
        }
        return totalWeight > 0 ? (int) Math.round(weighted / totalWeight) : 0;
    }

    private int score(QualityDimension dimension, PuzzleCandidate candidate, int difficulty) {
        return switch (dimension) {
            case CLARITY -> {
                int length = candidate.explanation() == null ? 0 : candidate.explanation().length();
                yield length > 20 && length < 200 ? CLEAR_EXPLANATION_SCORE : UNCLEAR_EXPLANATION_SCORE;
            }
            case CREATIVITY -> {
                OptionalInt novelty = candidate.complexity().get(candidate.type().creativityFactor());
                yield novelty.isPresent() ? novelty.getAsInt() * 10 : DEFAULT_CREATIVITY_SCORE;
            }
            case SOLVABILITY -> Math.min(100,
                    (int) Math.round(((11 - difficulty) * 10 + candidate.hints().size() * 15) / 2.0));
            case APPROPRIATENESS -> containsBlockedTerm(candidate) ? 0 : 100;
            case VISUAL_APPEAL -> candidate.type() == PuzzleType.REBUS
                    ? Math.min(100, componentExtractor.extract(candidate.content()).symbols().size() * 20)
                    : TEXT_LAYOUT_VISUAL_SCORE;
            case EDUCATIONAL_VALUE -> candidate.type().isEducationalCategory(candidate.category())
                    ? HIGH_VALUE_SCORE : STANDARD_VALUE_SCORE;
            case FUN_FACTOR -> {
                OptionalInt steps = candidate.complexity().get("cognitiveSteps");
                yield steps.isPresent() && steps.getAsInt() >= 5 && steps.getAsInt() <= 8
                        ? HIGH_VALUE_SCORE : STANDARD_VALUE_SCORE;
            }
        };
    }

    private List<String> actionItems(Map<QualityDimension, Integer> scores, RobustnessReport robustness, Verdict verdict) {
        List<String> items = new ArrayList<>();
        if (verdict == Verdict.REJECT) {
            items.add("Quality below acceptable threshold; generate a new puzzle");
        }
        scores.entrySet().stream()
                .filter(entry -> entry.getValue() < config.getActionItemThreshold())
                .sorted(Map.Entry.comparingByValue(Comparator.naturalOrder()))
                .forEach(entry -> items.add(entry.getKey().improvementHint()));
        if (robustness != null) {
            robustness.issues().stream()
                    .filter(issue -> issue.severity() != IssueSeverity.MINOR)
                    .forEach(issue -> items.add(issue.suggestion()));
        }
        return items.size() > config.getMaxActionItems() ? items.subList(0, config.getMaxActionItems()) : items;
    }

    private boolean containsBlockedTerm(PuzzleCandidate candidate) {
        if (config.getBlockedTerms() == null || config.getBlockedTerms().isEmpty()) {
            return false;
        }
        String text = String.join(" ", nullToEmpty(candidate.content()), nullToEmpty(candidate.answer()),
                nullToEmpty(candidate.explanation()), String.join(" ", candidate.hints())).toLowerCase(Locale.ROOT);
        return config.getBlockedTerms().stream()
                .filter(term -> term != null && !term.isBlank())
                .anyMatch(term -> text.contains(term.toLowerCase(Locale.ROOT)));
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static int clampScore(int score) {
        return Math.max(0, Math.min(100, score));
    }
}
