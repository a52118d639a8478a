package com.prepair.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Six competency axes, each an integer in [0, 10].
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompetencyScores {

    public static final int MIN = 0;
    public static final int MAX = 10;

    private int logicalThinking;
    private int communication;
    private int technicalDepth;
    private int problemSolving;
    private int proactiveness;
    private int growthPotential;

    public static int clamp(double raw) {
        if (Double.isNaN(raw)) {
            return MIN;
        }
        long rounded = Math.round(raw);
        return (int) Math.max(MIN, Math.min(MAX, rounded));
    }
}
