package uk.gegc.puzzlemaker.features.ai.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.puzzlemaker.features.ai.infra.AiErrorClassifier;
import uk.gegc.puzzlemaker.shared.config.AiRateLimitConfig;
import uk.gegc.puzzlemaker.shared.exception.AiErrorCode;
import uk.gegc.puzzlemaker.shared.exception.AiServiceException;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AiRetryExecutor Tests")
class AiRetryExecutorTest {

    private AiRateLimitConfig config;
    private List<Long> sleeps;
    private AiRetryExecutor executor;

    @BeforeEach
    void setUp() {
        config = new AiRateLimitConfig();
        sleeps = new ArrayList<>();
        executor = new AiRetryExecutor(config, new AiErrorClassifier()) {
            @Override
            protected void sleep(long delayMs) {
                sleeps.add(delayMs);
            }
        };
    }

    @Nested
    @DisplayName("Backoff delay")
    class BackoffTests {

        @Test
        @DisplayName("calculateBackoffDelay: doubles from the base delay")
        void calculateBackoffDelay_exponential() {
            assertThat(executor.calculateBackoffDelay(1)).isEqualTo(1000);
            assertThat(executor.calculateBackoffDelay(2)).isEqualTo(2000);
            assertThat(executor.calculateBackoffDelay(3)).isEqualTo(4000);
        }

        @Test
        @DisplayName("calculateBackoffDelay: capped at the maximum delay")
        void calculateBackoffDelay_capped() {
            assertThat(executor.calculateBackoffDelay(5)).isEqualTo(10000);
            assertThat(executor.calculateBackoffDelay(30)).isEqualTo(10000);
        }

        @Test
        @DisplayName("calculateBackoffDelay: jitter stays within its range")
        void calculateBackoffDelay_jitter() {
            config.setJitterFactor(0.5);

            for (int i = 0; i < 20; i++) {
                assertThat(executor.calculateBackoffDelay(2)).isBetween(1000L, 3000L);
            }
        }
    }

    @Test
    @DisplayName("withRetry: returns the first success without sleeping")
    void withRetry_success() {
        assertThat(executor.withRetry(() -> "ok")).isEqualTo("ok");
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("withRetry: transient failures are retried with growing delays")
    void withRetry_transientThenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.withRetry(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new AiServiceException("slow down", AiErrorCode.RATE_LIMITED);
            }
            return "done";
        });

        assertThat(result).isEqualTo("done");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(1000L, 2000L);
    }

    @Test
    @DisplayName("withRetry: gives up after max attempts with the last error")
    void withRetry_exhausted() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.withRetry(() -> {
            calls.incrementAndGet();
            throw new AiServiceException("gateway", AiErrorCode.GATEWAY_FAILURE);
        })).isInstanceOf(AiServiceException.class)
                .extracting(e -> ((AiServiceException) e).getCode())
                .isEqualTo(AiErrorCode.GATEWAY_FAILURE);

        assertThat(calls).hasValue(3);
        assertThat(sleeps).hasSize(2);
    }

    @Test
    @DisplayName("withRetry: quota exhaustion is not retried")
    void withRetry_quota_notRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.withRetry(() -> {
            calls.incrementAndGet();
            throw new AiServiceException("quota", AiErrorCode.QUOTA_EXCEEDED);
        })).isInstanceOf(AiServiceException.class);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    @DisplayName("withRetry: unclassified errors are wrapped and not retried")
    void withRetry_unknown_notRetried() {
        assertThatThrownBy(() -> executor.withRetry(() -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(AiServiceException.class)
                .hasCauseInstanceOf(IllegalStateException.class);

        assertThat(sleeps).isEmpty();
    }
}
