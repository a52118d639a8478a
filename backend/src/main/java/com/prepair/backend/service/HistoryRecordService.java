package com.prepair.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepair.backend.dto.FeedbackResult;
import com.prepair.backend.dto.PersistedResult;
import com.prepair.backend.entity.History;
import com.prepair.backend.entity.User;
import com.prepair.backend.exception.RecordNotFoundException;
import com.prepair.backend.repository.HistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes evaluation results to history and user records.
 *
 * Marking the history answered and crediting the user's points happen in
 * one transaction, so a crash cannot leave points without an answered record.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryRecordService {

    private final HistoryRepository historyRepository;
    private final ObjectMapper objectMapper;

    @Transactional(readOnly = true)
    public void requireHistory(Long historyId) {
        if (!historyRepository.existsById(historyId)) {
            throw new RecordNotFoundException("History", historyId);
        }
    }

    /**
     * Stores the result and credits the score to the owner when the history
     * was not answered before.
     *
     * @return the stored result with the points awarded by this call
     */
    @Transactional
    public PersistedResult applyResult(Long historyId, String answer, FeedbackResult result, boolean awardPoints) {
        History history = historyRepository.findById(historyId)
                .orElseThrow(() -> new RecordNotFoundException("History", historyId));
        User user = history.getUser();
        if (user == null) {
            throw new RecordNotFoundException("User of history", historyId);
        }

        boolean firstAnswer = history.getStatus() != History.HistoryStatus.ANSWERED;
        history.setAnswer(answer);
        history.setScore(result.getScore());
        history.setFeedback(serializeFeedback(result));
        history.setIssuesJson(serialize(result.getIssues()));
        history.setStatus(History.HistoryStatus.ANSWERED);

        int awarded = 0;
        if (awardPoints && firstAnswer) {
            awarded = result.getScore();
            user.addPoints(awarded);
        }
        log.info("History {} answered (score={}, awarded={}, userPoints={})",
                historyId, result.getScore(), awarded, user.getPoints());
        return PersistedResult.builder()
                .historyId(historyId)
                .userId(user.getId())
                .result(result)
                .pointsAwarded(awarded)
                .totalPoints(user.getPoints())
                .build();
    }

    private String serializeFeedback(FeedbackResult result) {
        return result.getFeedback() != null ? serialize(result.getFeedback()) : result.getMessage();
    }

    private String serialize(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize evaluation result", e);
        }
    }
}
