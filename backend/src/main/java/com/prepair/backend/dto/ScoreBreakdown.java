package com.prepair.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScoreBreakdown {
    private double relevanceScore;   // 0-25
    private double semanticScore;    // 0-40
    private double qualityScore;     // 0-35
    private double penalty;          // >= 0

    public double rawScore() {
        return relevanceScore + semanticScore + qualityScore - penalty;
    }
}
