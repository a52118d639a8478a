package com.prepair.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PersistedResult {
    private Long historyId;
    private Long userId;
    private FeedbackResult result;
    private int pointsAwarded;
    private long totalPoints;
}
