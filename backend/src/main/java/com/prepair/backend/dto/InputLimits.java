package com.prepair.backend.dto;

/**
 * Upper bounds on request text, enforced by Bean Validation on the request DTOs.
 */
public final class InputLimits {

    public static final int MAX_QUESTION_LENGTH = 1000;
    public static final int MAX_ANSWER_LENGTH = 5000;

    private InputLimits() {
    }
}
