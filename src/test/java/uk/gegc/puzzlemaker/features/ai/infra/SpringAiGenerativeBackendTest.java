package uk.gegc.puzzlemaker.features.ai.infra;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.core.task.support.TaskExecutorAdapter;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendRequest;
import uk.gegc.puzzlemaker.features.ai.domain.model.BackendResponse;
import uk.gegc.puzzlemaker.features.ai.domain.model.CapabilityTier;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SpringAiGenerativeBackend Tests")
class SpringAiGenerativeBackendTest {

    @Mock
    private ChatClient chatClient;

    @Mock
    private ChatClient.ChatClientRequestSpec requestSpec;

    @Mock
    private ChatClient.CallResponseSpec callResponseSpec;

    private SpringAiGenerativeBackend backend;

    @BeforeEach
    void setUp() {
        backend = new SpringAiGenerativeBackend(chatClient, new TaskExecutorAdapter(Runnable::run));
        lenient().when(chatClient.prompt()).thenReturn(requestSpec);
        lenient().when(requestSpec.system(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.user(anyString())).thenReturn(requestSpec);
        lenient().when(requestSpec.options(any(ChatOptions.class))).thenReturn(requestSpec);
        lenient().when(requestSpec.call()).thenReturn(callResponseSpec);
    }

    private static BackendRequest request(String systemPrompt) {
        return new BackendRequest("gpt-4.1-mini", systemPrompt, "make a rebus", 0.8, CapabilityTier.BALANCED, 1000);
    }

    private static ChatResponse responseWith(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("invoke: returns content and tags it with the requested model")
    void invoke_success() {
        when(callResponseSpec.chatResponse()).thenReturn(responseWith("{\"answer\":\"sunflower\"}"));

        BackendResponse response = backend.invoke(request("system"));

        assertThat(response.content()).isEqualTo("{\"answer\":\"sunflower\"}");
        assertThat(response.model()).isEqualTo("gpt-4.1-mini");
        assertThat(response.usage()).isNotNull();
    }

    @Test
    @DisplayName("invoke: model and temperature are set per call")
    void invoke_setsOptions() {
        when(callResponseSpec.chatResponse()).thenReturn(responseWith("{}"));

        backend.invoke(request("system"));

        ArgumentCaptor<ChatOptions> captor = ArgumentCaptor.forClass(ChatOptions.class);
        verify(requestSpec).options(captor.capture());
        assertThat(captor.getValue().getModel()).isEqualTo("gpt-4.1-mini");
        assertThat(captor.getValue().getTemperature()).isEqualTo(0.8);
        verify(requestSpec).system("system");
        verify(requestSpec).user("make a rebus");
    }

    @Test
    @DisplayName("invoke: blank system prompt is not sent")
    void invoke_blankSystemPrompt() {
        when(callResponseSpec.chatResponse()).thenReturn(responseWith("{}"));

        backend.invoke(request(" "));

        verify(requestSpec, never()).system(anyString());
    }

    @Test
    @DisplayName("invoke: blank output is a provider failure")
    void invoke_emptyResponse() {
        when(callResponseSpec.chatResponse()).thenReturn(responseWith("  "));

        assertThatThrownBy(() -> backend.invoke(request("system")))
                .isInstanceOf(AiServiceException.class)
                .extracting("code")
                .isEqualTo(AiErrorCode.PROVIDER_UNAVAILABLE);
    }

    @Test
    @DisplayName("invoke: missing response is a provider failure")
    void invoke_nullResponse() {
        when(callResponseSpec.chatResponse()).thenReturn(null);

        assertThatThrownBy(() -> backend.invoke(request("system")))
                .isInstanceOf(AiServiceException.class)
                .extracting("code")
                .isEqualTo(AiErrorCode.PROVIDER_UNAVAILABLE);
    }

    @Test
    @DisplayName("invoke: provider exceptions surface unchanged for classification")
    void invoke_providerFailure() {
        when(callResponseSpec.chatResponse()).thenThrow(new RuntimeException("429 - Rate limit reached"));

        assertThatThrownBy(() -> backend.invoke(request("system")))
                .isInstanceOf(RuntimeException.class)
                .hasMessage("429 - Rate limit reached");
    }

    @Test
    @DisplayName("invoke: call not finishing in time is a timeout")
    void invoke_timeout() {
        SpringAiGenerativeBackend stalled = new SpringAiGenerativeBackend(chatClient, new TaskExecutorAdapter(task -> {
        }));
        BackendRequest quick = new BackendRequest("gpt-4.1-mini", "system", "make a rebus", 0.8,
                CapabilityTier.BALANCED, 20);

        assertThatThrownBy(() -> stalled.invoke(quick))
                .isInstanceOf(AiServiceException.class)
                .hasMessageContaining("timed out")
                .extracting("code")
                .isEqualTo(AiErrorCode.TIMEOUT);
    }

    @Nested
    @DisplayName("On a real AI thread pool")
    class OnThreadPool {

        private ThreadPoolTaskExecutor executor;
        private final CountDownLatch release = new CountDownLatch(1);

        @BeforeEach
        void setUpPool() {
            executor = new ThreadPoolTaskExecutor();
            executor.setCorePoolSize(1);
            executor.setMaxPoolSize(1);
            executor.setQueueCapacity(0);
            executor.setThreadNamePrefix("ai-test-");
            executor.initialize();
        }

        @AfterEach
        void tearDownPool() {
            release.countDown();
            executor.shutdown();
        }

        @Test
        @DisplayName("invoke: saturated pool rejects the call as a transient provider failure without running it")
        void invoke_saturatedPool() {
            executor.execute(() -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            SpringAiGenerativeBackend pooled = new SpringAiGenerativeBackend(chatClient, executor);

            long start = System.nanoTime();
            assertThatThrownBy(() -> pooled.invoke(request("system")))
                    .isInstanceOf(AiServiceException.class)
                    .hasMessageContaining("saturated")
                    .satisfies(e -> assertThat(((AiServiceException) e).getCode().isBackoffRetryable()).isTrue())
                    .extracting("code")
                    .isEqualTo(AiErrorCode.PROVIDER_UNAVAILABLE);

            assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isLessThan(1000);
            verify(chatClient, never()).prompt();
        }

        @Test
        @DisplayName("invoke: hanging call times out and its worker thread is interrupted")
        void invoke_hangingCallInterrupted() throws InterruptedException {
            CountDownLatch interrupted = new CountDownLatch(1);
            when(callResponseSpec.chatResponse()).thenAnswer(invocation -> {
                try {
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw new IllegalStateException("interrupted", e);
                }
                return responseWith("{}");
            });
            SpringAiGenerativeBackend pooled = new SpringAiGenerativeBackend(chatClient, executor);
            BackendRequest quick = new BackendRequest("gpt-4.1-mini", "system", "make a rebus", 0.8,
                    CapabilityTier.BALANCED, 100);

            assertThatThrownBy(() -> pooled.invoke(quick))
                    .isInstanceOf(AiServiceException.class)
                    .extracting("code")
                    .isEqualTo(AiErrorCode.TIMEOUT);

            assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
        }
    }
}
