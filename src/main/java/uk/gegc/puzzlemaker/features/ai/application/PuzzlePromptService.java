package uk.gegc.puzzlemaker.features.ai.application;

import uk.gegc.puzzlemaker.features.ai.domain.model.PromptContext;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

public interface PuzzlePromptService {

    String buildSystemPrompt(PuzzleType puzzleType);

    String buildGenerationPrompt(PromptContext context);

    String loadPromptTemplate(String templateName);
}
