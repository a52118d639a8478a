package com.prepair.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersonalAnalysis {
    private CompetencyScores scores;
    private String strengths;
    private String improvements;
    private String recommendations;

    // Aggregates of the analysed history
    private int answerCount;
    private double averageScore;
    private boolean lowConfidence;
}
