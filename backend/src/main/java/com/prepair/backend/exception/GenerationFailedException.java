package com.prepair.backend.exception;

/**
 * Raised when a generation task exhausted its retry budget without a usable result.
 */
public class GenerationFailedException extends RuntimeException {

    private final int attempts;

    public GenerationFailedException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
