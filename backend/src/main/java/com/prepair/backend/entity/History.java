package com.prepair.backend.entity;

import lombok.*;
import jakarta.persistence.*;

/**
 * One question put to a user and, once answered, the evaluation of the answer.
 */
@Entity
@Table(name = "histories", indexes = {
        @Index(name = "idx_user_status", columnList = "user_id, status"),
        @Index(name = "idx_updated", columnList = "updated_at")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class History extends BaseEntity {

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    @Column(name = "question_id")
    private Long questionId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String question;

    @Column(columnDefinition = "TEXT")
    private String answer;

    private Integer score; // 0 - 100

    // NarrativeFeedback as JSON, or the plain message of a rejected answer
    @Column(columnDefinition = "TEXT")
    private String feedback;

    @Column(columnDefinition = "TEXT")
    private String issuesJson; // JSON array

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private HistoryStatus status = HistoryStatus.PENDING;

    public enum HistoryStatus {
        PENDING, ANSWERED
    }
}
