package uk.gegc.puzzlemaker.features.ai.domain.model;

import lombok.Builder;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

import java.util.List;

/**
 * Inputs to the generation prompt.
 *
 * @param avoidAnswers recently published answers the model must not repeat
 * @param feedback     action items from the previous attempt, empty on the first attempt
 */
@Builder
public record PromptContext(PuzzleType puzzleType,
                            int targetDifficulty,
                            String category,
                            boolean requireNovelty,
                            int attemptNumber,
                            List<String> avoidAnswers,
                            List<String> feedback) {

    public PromptContext {
        avoidAnswers = avoidAnswers == null ? List.of() : List.copyOf(avoidAnswers);
        feedback = feedback == null ? List.of() : List.copyOf(feedback);
    }
}
