package com.prepair.backend.service;

import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.exception.GenerationFailedException;
import com.prepair.backend.exception.ProviderUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a generation task until it yields a parsed result or the retry budget
 * is spent. Attempts are sequential and separated by a fixed delay.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RetryExecutor {

    private final EvaluationProperties properties;

    /**
     * @param maxRetries retries after the first attempt, so at most {@code maxRetries + 1} calls
     * @throws GenerationFailedException when every attempt failed
     */
    public <T> T execute(String task, int maxRetries, Supplier<ParseResult<T>> attempt) {
        int maxAttempts = Math.max(0, maxRetries) + 1;
        RuntimeException lastError = null;
        String lastReason = null;

        for (int attemptNo = 1; attemptNo <= maxAttempts; attemptNo++) {
            if (attemptNo > 1) {
                pause(task, attemptNo);
            }
            try {
                ParseResult<T> result = attempt.get();
                if (result.isParsed()) {
                    if (attemptNo > 1) {
                        log.info("{} succeeded on attempt {}/{}", task, attemptNo, maxAttempts);
                    }
                    return result.getValue();
                }
                lastReason = result.getFailureReason();
                lastError = null;
                log.warn("⚠️ {} attempt {}/{} returned unusable output: {}", task, attemptNo, maxAttempts, lastReason);
            } catch (ProviderUnavailableException e) {
                lastReason = e.getMessage();
                lastError = e;
                log.warn("⚠️ {} attempt {}/{} failed: {}", task, attemptNo, maxAttempts, lastReason);
            }
        }

        throw new GenerationFailedException(
                task + " failed after " + maxAttempts + " attempts: " + lastReason, maxAttempts, lastError);
    }

    private void pause(String task, int attemptNo) {
        Duration delay = properties.getRetryDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            Thread.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationFailedException(task + " interrupted before attempt " + attemptNo, attemptNo - 1, null);
        }
    }
}
