package uk.gegc.puzzlemaker.features.uniqueness.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.puzzle.domain.model.PuzzleCandidate;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Deterministic identity of a puzzle: SHA-256 over the normalized answer, the sorted
 * symbol set, the sorted lower-cased text tokens and the category.
 */
@Component
@RequiredArgsConstructor
public class PuzzleFingerprinter {

    private static final String SEPARATOR = "::";

    private final PuzzleComponentExtractor componentExtractor;

    public String fingerprint(PuzzleCandidate candidate) {
        return fingerprint(candidate.content(), candidate.answer(), candidate.category());
    }

    public String fingerprint(String content, String answer, String category) {
        String canonical = normalizeAnswer(answer)
                + SEPARATOR + String.join("", componentExtractor.notableSymbols(content))
                + SEPARATOR + textKey(content)
                + SEPARATOR + normalizeText(category);
        return sha256Hex(canonical);
    }

    static String normalizeAnswer(String answer) {
        return normalizeText(answer).replaceAll("[^\\p{L}\\p{M}\\p{N}]", "");
    }

    private String textKey(String content) {
        return String.join("_", componentExtractor.extract(content).textTokens().stream()
                .map(token -> token.toLowerCase(Locale.ROOT))
                .sorted()
                .toList());
    }

    private static String normalizeText(String input) {
        if (input == null) {
            return "";
        }
        return Normalizer.normalize(input, Normalizer.Form.NFKC)
                .toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }

    private static String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
