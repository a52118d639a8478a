package com.prepair.backend.exception;

public class InsufficientHistoryException extends RuntimeException {

    public InsufficientHistoryException(Long userId) {
        super("No answered history for user " + userId);
    }
}
