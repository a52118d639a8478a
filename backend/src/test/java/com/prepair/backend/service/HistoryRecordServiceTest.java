package com.prepair.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepair.backend.dto.EvaluationIssue;
import com.prepair.backend.dto.FeedbackResult;
import com.prepair.backend.dto.NarrativeFeedback;
import com.prepair.backend.dto.PersistedResult;
import com.prepair.backend.entity.History;
import com.prepair.backend.entity.User;
import com.prepair.backend.exception.RecordNotFoundException;
import com.prepair.backend.repository.HistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoryRecordServiceTest {

    @Mock
    private HistoryRepository historyRepository;

    private HistoryRecordService service;
    private User user;
    private History history;

    @BeforeEach
    void setUp() {
        service = new HistoryRecordService(historyRepository, new ObjectMapper());

        user = new User();
        user.setId(3L);
        user.setNickname("tester");
        user.setPoints(100L);

        history = new History();
        history.setId(11L);
        history.setUser(user);
        history.setQuestion("질문");
    }

    @Test
    void shouldMarkAnsweredAndAwardPoints() {
        when(historyRepository.findById(11L)).thenReturn(Optional.of(history));
        FeedbackResult result = FeedbackResult.builder()
                .score(72)
                .feedback(new NarrativeFeedback("a", "b", "c"))
                .issues(List.of(EvaluationIssue.LACKS_DETAIL))
                .build();

        PersistedResult persisted = service.applyResult(11L, "답변", result, true);

        assertThat(history.getStatus()).isEqualTo(History.HistoryStatus.ANSWERED);
        assertThat(history.getScore()).isEqualTo(72);
        assertThat(history.getAnswer()).isEqualTo("답변");
        assertThat(history.getFeedback()).contains("\"good\":\"a\"");
        assertThat(history.getIssuesJson()).isEqualTo("[\"" + EvaluationIssue.LACKS_DETAIL + "\"]");
        assertThat(user.getPoints()).isEqualTo(172L);
        assertThat(persisted.getPointsAwarded()).isEqualTo(72);
        assertThat(persisted.getTotalPoints()).isEqualTo(172L);
        assertThat(persisted.getUserId()).isEqualTo(3L);
    }

    @Test
    void shouldStoreMessageOfRejectedAnswer() {
        when(historyRepository.findById(11L)).thenReturn(Optional.of(history));

        service.applyResult(11L, "모르겠습니다",
                FeedbackResult.rejected(0, "답변이 너무 짧습니다.", List.of(EvaluationIssue.ANSWER_TOO_SHORT)), true);

        assertThat(history.getFeedback()).isEqualTo("답변이 너무 짧습니다.");
        assertThat(user.getPoints()).isEqualTo(100L);
    }

    @Test
    void shouldNotAwardPointsTwice() {
        history.setStatus(History.HistoryStatus.ANSWERED);
        when(historyRepository.findById(11L)).thenReturn(Optional.of(history));

        PersistedResult persisted = service.applyResult(11L, "답변",
                FeedbackResult.builder().score(90).feedback(new NarrativeFeedback("a", "b", "c")).build(), true);

        assertThat(persisted.getPointsAwarded()).isZero();
        assertThat(user.getPoints()).isEqualTo(100L);
        assertThat(history.getScore()).isEqualTo(90);
    }

    @Test
    void shouldNotAwardPointsWhenRegenerating() {
        when(historyRepository.findById(11L)).thenReturn(Optional.of(history));

        service.applyResult(11L, "답변",
                FeedbackResult.builder().score(90).feedback(new NarrativeFeedback("a", "b", "c")).build(), false);

        assertThat(user.getPoints()).isEqualTo(100L);
        assertThat(history.getStatus()).isEqualTo(History.HistoryStatus.ANSWERED);
    }

    @Test
    void shouldRejectUnknownHistory() {
        when(historyRepository.findById(99L)).thenReturn(Optional.empty());
        when(historyRepository.existsById(99L)).thenReturn(false);

        assertThatThrownBy(() -> service.applyResult(99L, "답변", FeedbackResult.rejected(0, "m", List.of()), true))
                .isInstanceOf(RecordNotFoundException.class)
                .hasMessage("History not found: 99");
        assertThatThrownBy(() -> service.requireHistory(99L)).isInstanceOf(RecordNotFoundException.class);
    }
}
