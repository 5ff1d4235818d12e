package uk.gegc.puzzlemaker.features.quality.application;

import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.quality.domain.model.IssueSeverity;
import uk.gegc.puzzlemaker.features.quality.domain.model.RobustnessIssue;
import uk.gegc.puzzlemaker.features.quality.domain.model.RobustnessReport;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Adversarial checks a solver could exploit or stumble on: a leaked answer,
 * repeated hints, an explanation unrelated to the answer, hints that do not build up.
 */
@Component
public class RobustnessChecker {

    private static final int MIN_LEAK_LENGTH = 3;

    public RobustnessReport check(PuzzleCandidate candidate) {
        List<RobustnessIssue> issues = new ArrayList<>();
        String answer = compact(candidate.answer());
        List<String> hints = candidate.hints();

        if (answer.length() >= MIN_LEAK_LENGTH && compact(candidate.content()).contains(answer)) {
            issues.add(new RobustnessIssue(IssueSeverity.CRITICAL,
                    "Answer appears verbatim in the puzzle",
                    "Express the answer only through symbols or wordplay"));
        }
        if (answer.length() >= MIN_LEAK_LENGTH && !hints.isEmpty() && compact(hints.get(0)).contains(answer)) {
            issues.add(new RobustnessIssue(IssueSeverity.CRITICAL,
                    "First hint gives the answer away",
                    "Start with a vague hint and reveal more gradually"));
        }

        Set<String> distinctHints = new HashSet<>();
        hints.forEach(hint -> distinctHints.add(compact(hint)));
        if (distinctHints.size() < hints.size()) {
            issues.add(new RobustnessIssue(IssueSeverity.MAJOR,
                    "Hints repeat each other",
                    "Make every hint add new information"));
        }

        List<String> answerTokens = answerTokens(candidate.answer());
        String explanation = candidate.explanation() == null ? "" : candidate.explanation().toLowerCase(Locale.ROOT);
        if (!answerTokens.isEmpty() && answerTokens.stream().noneMatch(explanation::contains)) {
            issues.add(new RobustnessIssue(IssueSeverity.MAJOR,
                    "Explanation does not refer to the answer",
                    "Explain how the puzzle leads to the answer"));
        }

        if (hints.size() >= 2 && length(hints.get(hints.size() - 1)) <= length(hints.get(0))) {
            issues.add(new RobustnessIssue(IssueSeverity.MINOR,
                    "Hints do not get more specific",
                    "Order hints from general to specific"));
        }

        int penalty = issues.stream().mapToInt(issue -> issue.severity().penalty()).sum();
        boolean passed = issues.stream().noneMatch(issue -> issue.severity() == IssueSeverity.CRITICAL);
        return new RobustnessReport(Math.max(0, 100 - penalty), passed, issues);
    }

    private static List<String> answerTokens(String answer) {
        if (answer == null) {
            return List.of();
        }
        return Arrays.stream(answer.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"))
                .filter(token -> token.length() >= MIN_LEAK_LENGTH)
                .toList();
    }

    private static String compact(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}]", "");
    }

    private static int length(String value) {
        return value == null ? 0 : value.trim().length();
    }
}
