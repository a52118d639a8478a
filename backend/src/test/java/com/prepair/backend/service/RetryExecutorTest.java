package com.prepair.backend.service;

import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.exception.GenerationFailedException;
import com.prepair.backend.exception.ProviderUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        EvaluationProperties properties = new EvaluationProperties();
        properties.setRetryDelay(Duration.ZERO);
        retryExecutor = new RetryExecutor(properties);
    }

    @Test
    void shouldReturnFirstParsedValue() {
        AtomicInteger calls = new AtomicInteger();

        String value = retryExecutor.execute("task", 2, () -> {
            calls.incrementAndGet();
            return ParseResult.parsed("ok");
        });

        assertThat(value).isEqualTo("ok");
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldRetryMalformedOutputAndProviderFailures() {
        AtomicInteger calls = new AtomicInteger();

        String value = retryExecutor.execute("task", 2, () -> {
            int call = calls.incrementAndGet();
            if (call == 1) {
                return ParseResult.failure("garbled");
            }
            if (call == 2) {
                throw new ProviderUnavailableException("down");
            }
            return ParseResult.parsed("third time");
        });

        assertThat(value).isEqualTo("third time");
        assertThat(calls).hasValue(3);
    }

    @Test
    void shouldStopAfterRetryBudget() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryExecutor.execute("task", 2, () -> {
            calls.incrementAndGet();
            return ParseResult.<String>failure("garbled");
        }))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("garbled")
                .extracting(e -> ((GenerationFailedException) e).getAttempts())
                .isEqualTo(3);

        assertThat(calls).hasValue(3);
    }

    @Test
    void shouldMakeSingleAttemptWithZeroRetries() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryExecutor.execute("task", 0, () -> {
            calls.incrementAndGet();
            throw new ProviderUnavailableException("down");
        })).isInstanceOf(GenerationFailedException.class)
                .hasCauseInstanceOf(ProviderUnavailableException.class);

        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldNotRetryUnexpectedExceptions() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryExecutor.execute("task", 2, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(calls).hasValue(1);
    }
}
