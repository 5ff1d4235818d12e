package uk.gegc.puzzlemaker.features.ai.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;
import uk.gegc.puzzlemaker.features.ai.application.GenerativeBackend;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendRequest;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendResponse;
import uk.gegc.puzzlemaker.features.ai.domain.model.UsageStats;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * {@link GenerativeBackend} on top of Spring AI's {@link ChatClient}. The model and
 * temperature are set per call; the call runs on the AI executor and is cancelled
 * (interrupting the worker) once the request's timeout elapses. A saturated executor
 * fails the call as a transient provider outage.
 */
@Component
@Slf4j
public class SpringAiGenerativeBackend implements GenerativeBackend {

    private final ChatClient chatClient;
    private final AsyncTaskExecutor aiTaskExecutor;

    public SpringAiGenerativeBackend(ChatClient chatClient,
                                     @Qualifier("aiTaskExecutor") AsyncTaskExecutor aiTaskExecutor) {
        this.chatClient = chatClient;
        this.aiTaskExecutor = aiTaskExecutor;
    }

    @Override
    public BackendResponse invoke(BackendRequest request) {
        Future<BackendResponse> future;
        try {
            future = aiTaskExecutor.submit(() -> call(request));
        } catch (RejectedExecutionException e) {
            log.warn("AI executor saturated, rejecting call to model {}", request.model());
            throw new AiServiceException("AI executor saturated; call to model " + request.model() + " rejected",
                    AiErrorCode.PROVIDER_UNAVAILABLE, e);
        }
        try {
            return future.get(request.timeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AiServiceException(
                    "Model " + request.model() + " timed out after " + request.timeoutMs() + " ms",
                    AiErrorCode.TIMEOUT, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new AiServiceException("Model " + request.model() + " call failed: " + cause.getMessage(),
                    AiErrorCode.UNKNOWN, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new AiServiceException("Interrupted while waiting for model " + request.model(),
                    AiErrorCode.UNKNOWN, e);
        }
    }

    BackendResponse call(BackendRequest request) {
        Instant start = Instant.now();

        ChatOptions options = ChatOptions.builder()
                .model(request.model())
                .temperature(request.temperature())
                .build();

        ChatClient.ChatClientRequestSpec spec = chatClient.prompt();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            spec = spec.system(request.systemPrompt());
        }
        ChatResponse response = spec
                .user(request.promptPayload())
                .options(options)
                .call()
                .chatResponse();

        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new AiServiceException("No response received from model " + request.model(),
                    AiErrorCode.PROVIDER_UNAVAILABLE);
        }
        String content = response.getResult().getOutput().getText();
        if (content == null || content.isBlank()) {
            throw new AiServiceException("Empty response received from model " + request.model(),
                    AiErrorCode.PROVIDER_UNAVAILABLE);
        }

        UsageStats usage = usageOf(response);
        log.info("AI response received - Model: {}, Tokens: {}, Latency: {}ms",
                request.model(), usage.totalTokens(), Duration.between(start, Instant.now()).toMillis());
        return new BackendResponse(content, usage, request.model());
    }

    private static UsageStats usageOf(ChatResponse response) {
        if (response.getMetadata() == null || response.getMetadata().getUsage() == null) {
            return UsageStats.empty();
        }
        Usage usage = response.getMetadata().getUsage();
        return new UsageStats(
                usage.getPromptTokens() != null ? usage.getPromptTokens() : 0,
                usage.getCompletionTokens() != null ? usage.getCompletionTokens() : 0,
                usage.getTotalTokens() != null ? usage.getTotalTokens() : 0);
    }
}
