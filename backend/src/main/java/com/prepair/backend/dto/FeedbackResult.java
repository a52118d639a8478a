package com.prepair.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of scoring one answer.
 *
 * {@code feedback} is set once the pipeline reached feedback generation;
 * answers rejected by an early gate carry a plain {@code message} instead.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FeedbackResult {
    private int score;
    private NarrativeFeedback feedback;
    private String message;
    @Builder.Default
    private List<String> issues = new ArrayList<>();

    public static FeedbackResult rejected(int score, String message, List<String> issues) {
        return FeedbackResult.builder()
                .score(score)
                .message(message)
                .issues(List.copyOf(issues))
                .build();
    }
}
