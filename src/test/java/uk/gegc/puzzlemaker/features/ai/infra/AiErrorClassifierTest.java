package uk.gegc.puzzlemaker.features.ai.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AiErrorClassifier Tests")
class AiErrorClassifierTest {

    private final AiErrorClassifier classifier = new AiErrorClassifier();

    @ParameterizedTest(name = "\"{0}\" -> {1}")
    @CsvSource(delimiter = '|', value = {
            "404 - {\"error\":{\"code\":\"model_not_found\"}}|MODEL_NOT_FOUND",
            "The model gpt-x is not supported for this endpoint|MODEL_NOT_FOUND",
            "429 - You exceeded your current quota|QUOTA_EXCEEDED",
            "RESOURCE_EXHAUSTED: daily limit|QUOTA_EXCEEDED",
            "429 - Rate limit reached for requests|RATE_LIMITED",
            "Too Many Requests|RATE_LIMITED",
            "Rate limit reached: TPM|RATE_LIMITED",
            "502 - Bad Gateway|GATEWAY_FAILURE",
            "AI gateway request failed|GATEWAY_FAILURE",
            "503 - Service Unavailable|PROVIDER_UNAVAILABLE",
            "401 - Incorrect API key provided|AUTHENTICATION",
            "400 - Invalid messages parameter|INVALID_REQUEST",
            "Something odd happened|UNKNOWN"
    })
    void codeFor_messages(String message, AiErrorCode expected) {
        assertThat(classifier.codeFor(new RuntimeException(message))).isEqualTo(expected);
    }

    @Test
    @DisplayName("codeFor: HTTP status exceptions use their status code")
    void codeFor_httpStatus() {
        assertThat(classifier.codeFor(HttpClientErrorException.create(HttpStatus.NOT_FOUND, "Not Found", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8)))
                .isEqualTo(AiErrorCode.MODEL_NOT_FOUND);
        assertThat(classifier.codeFor(HttpClientErrorException.create(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8)))
                .isEqualTo(AiErrorCode.RATE_LIMITED);
        assertThat(classifier.codeFor(HttpClientErrorException.create(HttpStatus.UNAUTHORIZED, "Unauthorized", new HttpHeaders(), new byte[0], StandardCharsets.UTF_8)))
                .isEqualTo(AiErrorCode.AUTHENTICATION);
    }

    @Test
    @DisplayName("codeFor: Spring AI transient and non-transient exceptions without status")
    void codeFor_springAiExceptions() {
        assertThat(classifier.codeFor(new TransientAiException("connection reset"))).isEqualTo(AiErrorCode.PROVIDER_UNAVAILABLE);
        assertThat(classifier.codeFor(new NonTransientAiException("bad input"))).isEqualTo(AiErrorCode.INVALID_REQUEST);
    }

    @Test
    @DisplayName("codeFor: timeouts, also when wrapped")
    void codeFor_timeout() {
        assertThat(classifier.codeFor(new CompletionException(new TimeoutException()))).isEqualTo(AiErrorCode.TIMEOUT);
    }

    @Test
    @DisplayName("classify: already classified exceptions are returned unchanged")
    void classify_passThrough() {
        AiServiceException original = new AiServiceException("quota", AiErrorCode.QUOTA_EXCEEDED);

        assertThat(classifier.classify(original)).isSameAs(original);
        assertThat(classifier.classify(new CompletionException(original))).isSameAs(original);
    }

    @Test
    @DisplayName("classify: wraps other exceptions keeping the cause")
    void classify_wraps() {
        RuntimeException cause = new RuntimeException("503 - overloaded");

        AiServiceException classified = classifier.classify(cause);

        assertThat(classified.getCode()).isEqualTo(AiErrorCode.PROVIDER_UNAVAILABLE);
        assertThat(classified).hasCause(cause);
    }
}
