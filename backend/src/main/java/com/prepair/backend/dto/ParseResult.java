package com.prepair.backend.dto;

import java.util.function.Function;

/**
 * Outcome of reading structured data out of model output: either a parsed
 * value or the reason it could not be read.
 */
public final class ParseResult<T> {

    private final T value;
    private final String failureReason;

    private ParseResult(T value, String failureReason) {
        this.value = value;
        this.failureReason = failureReason;
    }

    public static <T> ParseResult<T> parsed(T value) {
        if (value == null) {
            throw new IllegalArgumentException("Parsed value must not be null");
        }
        return new ParseResult<>(value, null);
    }

    public static <T> ParseResult<T> failure(String reason) {
        return new ParseResult<>(null, reason);
    }

    public boolean isParsed() {
        return value != null;
    }

    public T getValue() {
        if (value == null) {
            throw new IllegalStateException("No parsed value: " + failureReason);
        }
        return value;
    }

    public String getFailureReason() {
        return failureReason;
    }

    /**
     * Applies a validating mapper; the mapper returns a failure to reject the value.
     */
    public <R> ParseResult<R> flatMap(Function<T, ParseResult<R>> mapper) {
        return isParsed() ? mapper.apply(value) : failure(failureReason);
    }

    @Override
    public String toString() {
        return isParsed() ? "Parsed[" + value + "]" : "ParseFailure[" + failureReason + "]";
    }
}
