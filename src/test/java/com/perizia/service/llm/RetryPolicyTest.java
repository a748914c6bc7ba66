package com.perizia.service.llm;

import com.perizia.Exception.LlmProviderException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final List<Long> sleeps = new ArrayList<>();

    private RetryPolicy policy(int maxAttempts) {
        return RetryPolicy.transientProviderErrors(maxAttempts, Duration.ofMillis(100), Duration.ofMillis(250))
            .withSleeper(sleeps::add);
    }

    @Test
    void retriesTransientErrorsUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy(3).execute("test", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new LlmProviderException(ProviderErrorCode.UNAVAILABLE, "unavailable", null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
        assertThat(sleeps).containsExactly(100L, 200L);
    }

    @Test
    void backoffIsCappedAtMaxInterval() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(4).execute("test", () -> {
            calls.incrementAndGet();
            throw new LlmProviderException(ProviderErrorCode.OVERLOADED, "overloaded", null);
        })).isInstanceOf(LlmProviderException.class);

        assertThat(calls).hasValue(4);
        assertThat(sleeps).containsExactly(100L, 200L, 250L);
    }

    @Test
    void permanentErrorIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(3).execute("test", () -> {
            calls.incrementAndGet();
            throw new LlmProviderException(ProviderErrorCode.PERMISSION_DENIED, "denied", null);
        }))
            .isInstanceOf(LlmProviderException.class)
            .extracting(e -> ((LlmProviderException) e).getCode())
            .isEqualTo(ProviderErrorCode.PERMISSION_DENIED);

        assertThat(calls).hasValue(1);
        assertThat(sleeps).isEmpty();
    }

    @Test
    void nonProviderExceptionIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy(3).execute("test", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void rejectsZeroAttempts() {
        assertThatThrownBy(() -> RetryPolicy.of(0, Duration.ofMillis(1), Duration.ofMillis(1), e -> true))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
