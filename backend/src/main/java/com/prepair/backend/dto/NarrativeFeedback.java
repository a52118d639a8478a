package com.prepair.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class NarrativeFeedback {
    private String good;
    private String improvement;
    private String recommendation;

    // Set only on the neutral text used when generation failed; never serialized
    @JsonIgnore
    private boolean fallback;

    public NarrativeFeedback(String good, String improvement, String recommendation) {
        this.good = good;
        this.improvement = improvement;
        this.recommendation = recommendation;
    }

    public static NarrativeFeedback fallback(String good, String improvement, String recommendation) {
        NarrativeFeedback feedback = new NarrativeFeedback(good, improvement, recommendation);
        feedback.fallback = true;
        return feedback;
    }

    @JsonIgnore
    public boolean isComplete() {
        return notBlank(good) && notBlank(improvement) && notBlank(recommendation);
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
