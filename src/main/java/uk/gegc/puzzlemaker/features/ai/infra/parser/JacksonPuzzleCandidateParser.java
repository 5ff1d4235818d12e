package uk.gegc.puzzlemaker.features.ai.infra.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.ComplexityProfile;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleType;
import uk.gegc.puzzlemaker.shared.exception.AIResponseParseException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
@RequiredArgsConstructor
@Slf4j
public class JacksonPuzzleCandidateParser implements PuzzleCandidateParser {

    private static final List<String> PROFILE_FIELDS = List.of("complexity", "difficultyProfile", "complexityProfile");

    private final ObjectMapper objectMapper;

    @Override
    public PuzzleCandidate parse(String rawResponse, PuzzleType puzzleType) {
        if (rawResponse == null || rawResponse.isBlank()) {
            throw new AIResponseParseException("Empty response from model");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(extractJsonObject(cleanJsonResponse(rawResponse)));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse model response: {}", e.getOriginalMessage());
            throw new AIResponseParseException("Model response is not valid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new AIResponseParseException("Model response must be a JSON object");
        }

        String content = text(root, puzzleType.contentField());
        if (content == null) {
            content = text(root, "content");
        }
        String category = text(root, "category");

        return new PuzzleCandidate(
                puzzleType,
                content,
                text(root, "answer"),
                text(root, "explanation"),
                hints(root.get("hints")),
                category == null ? null : category.trim().toLowerCase(Locale.ROOT),
                difficulty(root.get("difficulty")),
                complexity(root));
    }

    String cleanJsonResponse(String response) {
        String cleaned = response.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    /**
     * Drops any prose around the outermost JSON object.
     */
    private String extractJsonObject(String response) {
        int start = response.indexOf('{');
        int end = response.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new AIResponseParseException("No JSON object found in model response");
        }
        return response.substring(start, end + 1);
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        return node.asText();
    }

    private static List<String> hints(JsonNode node) {
        List<String> hints = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return hints;
        }
        for (JsonNode hint : node) {
            if (hint != null && hint.isValueNode() && !hint.isNull()) {
                hints.add(hint.asText());
            }
        }
        return hints;
    }

    private static Integer difficulty(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        double value = node.asDouble();
        return Double.isFinite(value) ? ComplexityProfile.clampScore(value) : null;
    }

    private static ComplexityProfile complexity(JsonNode root) {
        for (String field : PROFILE_FIELDS) {
            JsonNode node = root.get(field);
            if (node != null && node.isObject()) {
                Map<String, Object> raw = new LinkedHashMap<>();
                node.fields().forEachRemaining(entry ->
                        raw.put(entry.getKey(), entry.getValue().isNumber() ? entry.getValue().numberValue() : null));
                return ComplexityProfile.coerce(raw);
            }
        }
        return ComplexityProfile.empty();
    }
}
