package uk.gegc.puzzlemaker.features.ai.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;
import uk.gegc.puzzlemaker.features.ai.application.PuzzlePromptService;
import uk.gegc.puzzlemaker.features.ai.domain.model.PromptContext;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Builds prompts from templates under {@code classpath:prompts/}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PuzzlePromptServiceImpl implements PuzzlePromptService {

    private static final String SYSTEM_PROMPT = "base/system-prompt.txt";
    private static final String NONE = "none";

    private final ResourceLoader resourceLoader;
    private final Map<String, String> templateCache = new ConcurrentHashMap<>();

    @Override
    public String buildSystemPrompt(PuzzleType puzzleType) {
        return loadPromptTemplate(SYSTEM_PROMPT)
                .replace("{puzzleType}", puzzleType.name().toLowerCase(Locale.ROOT).replace('_', ' '));
    }

    @Override
    public String buildGenerationPrompt(PromptContext context) {
        if (context == null || context.puzzleType() == null) {
            throw new IllegalArgumentException("Prompt context and puzzle type are required");
        }
        PuzzleType type = context.puzzleType();
        String category = context.category() == null || context.category().isBlank()
                ? "any of: " + String.join(", ", type.categories())
                : context.category();

        return loadPromptTemplate(type.promptTemplate())
                .replace("{difficulty}", String.valueOf(context.targetDifficulty()))
                .replace("{category}", category)
                .replace("{contentField}", type.contentField())
                .replace("{factors}", type.factors().stream()
                        .map(factor -> "\"" + factor.name() + "\"")
                        .collect(Collectors.joining(", ")))
                .replace("{novelty}", context.requireNovelty()
                        ? "The puzzle MUST use a wordplay pattern and symbols that feel completely fresh."
                        : "Prefer fresh ideas over well-known puzzles.")
                .replace("{avoidAnswers}", bulletList(context.avoidAnswers()))
                .replace("{feedback}", bulletList(context.feedback()))
                .replace("{attempt}", String.valueOf(context.attemptNumber()));
    }

    @Override
    public String loadPromptTemplate(String templateName) {
        return templateCache.computeIfAbsent(templateName, this::loadTemplateFromResources);
    }

    private String loadTemplateFromResources(String templateName) {
        try {
            Resource resource = resourceLoader.getResource("classpath:prompts/" + templateName);
            return new String(resource.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.error("Failed to load template: {}", templateName, e);
            throw new UncheckedIOException("Failed to load template: " + templateName, e);
        }
    }

    private static String bulletList(List<String> items) {
        if (items.isEmpty()) {
            return NONE;
        }
        return items.stream().map(item -> "- " + item).collect(Collectors.joining("\n"));
    }
}
