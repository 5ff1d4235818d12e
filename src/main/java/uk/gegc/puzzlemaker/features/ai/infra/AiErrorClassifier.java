package uk.gegc.puzzlemaker.features.ai.infra;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps provider failures onto {@link AiErrorCode}. The only place that inspects
 * provider status codes and error text.
 */
@Component
public class AiErrorClassifier {

    /**
     * Spring AI's response error handler formats messages as "{status} - {body}"
     */
    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(\\d{3})\\s*-");

    public AiServiceException classify(Throwable error) {
        if (error instanceof AiServiceException aiServiceException) {
            return aiServiceException;
        }
        Throwable root = unwrap(error);
        if (root instanceof AiServiceException aiServiceException) {
            return aiServiceException;
        }
        AiErrorCode code = codeFor(root);
        String message = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return new AiServiceException(message, code, root);
    }

    public AiErrorCode codeFor(Throwable error) {
        Throwable root = unwrap(error);
        if (root instanceof AiServiceException aiServiceException) {
            return aiServiceException.getCode();
        }
        if (root instanceof TimeoutException || root instanceof SocketTimeoutException) {
            return AiErrorCode.TIMEOUT;
        }

        String message = root.getMessage() == null ? "" : root.getMessage();

        Integer status = null;
        if (root instanceof RestClientResponseException responseException) {
            status = responseException.getStatusCode().value();
        } else {
            Matcher matcher = LEADING_STATUS.matcher(message);
            if (matcher.find()) {
                status = Integer.parseInt(matcher.group(1));
            }
        }
        if (status != null) {
            AiErrorCode byStatus = fromStatus(status, message);
            if (byStatus != null) {
                return byStatus;
            }
        }

        AiErrorCode byMessage = fromMessage(message);
        if (byMessage != null) {
            return byMessage;
        }
        if (root instanceof ResourceAccessException) {
            return AiErrorCode.GATEWAY_FAILURE;
        }
        if (root instanceof TransientAiException) {
            return AiErrorCode.PROVIDER_UNAVAILABLE;
        }
        if (root instanceof NonTransientAiException) {
            return AiErrorCode.INVALID_REQUEST;
        }
        return AiErrorCode.UNKNOWN;
    }

    private AiErrorCode fromStatus(int status, String message) {
        return switch (status) {
            case 400, 422 -> isModelNotFound(message.toLowerCase(Locale.ROOT))
                    ? AiErrorCode.MODEL_NOT_FOUND : AiErrorCode.INVALID_REQUEST;
            case 401, 403 -> AiErrorCode.AUTHENTICATION;
            case 404 -> AiErrorCode.MODEL_NOT_FOUND;
            case 429 -> isQuota(message.toLowerCase(Locale.ROOT), message)
                    ? AiErrorCode.QUOTA_EXCEEDED : AiErrorCode.RATE_LIMITED;
            case 502, 504 -> AiErrorCode.GATEWAY_FAILURE;
            case 503 -> AiErrorCode.PROVIDER_UNAVAILABLE;
            case 408 -> AiErrorCode.TIMEOUT;
            default -> null;
        };
    }

    private AiErrorCode fromMessage(String message) {
        String lower = message.toLowerCase(Locale.ROOT);
        if (isModelNotFound(lower)) {
            return AiErrorCode.MODEL_NOT_FOUND;
        }
        if (isQuota(lower, message)) {
            return AiErrorCode.QUOTA_EXCEEDED;
        }
        if (lower.contains("429")
                || lower.contains("rate limit")
                || lower.contains("rate_limit")
                || lower.contains("too many requests")
                || message.contains("TPM")
                || message.contains("RPM")) {
            return AiErrorCode.RATE_LIMITED;
        }
        if (lower.contains("gateway") || lower.contains("502") || lower.contains("504")) {
            return AiErrorCode.GATEWAY_FAILURE;
        }
        if (lower.contains("503") || lower.contains("service unavailable") || lower.contains("overloaded")) {
            return AiErrorCode.PROVIDER_UNAVAILABLE;
        }
        if (lower.contains("timed out") || lower.contains("timeout")) {
            return AiErrorCode.TIMEOUT;
        }
        if (lower.contains("401") || lower.contains("unauthorized") || lower.contains("invalid api key")
                || lower.contains("incorrect api key")) {
            return AiErrorCode.AUTHENTICATION;
        }
        return null;
    }

    private static boolean isModelNotFound(String lower) {
        return lower.contains("model_not_found")
                || (lower.contains("model") && (lower.contains("not found") || lower.contains("not supported")
                || lower.contains("does not exist")));
    }

    private static boolean isQuota(String lower, String message) {
        return lower.contains("quota")
                || lower.contains("insufficient_quota")
                || message.contains("RESOURCE_EXHAUSTED");
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
