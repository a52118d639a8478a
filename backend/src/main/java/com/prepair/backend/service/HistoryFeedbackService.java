package com.prepair.backend.service;

import com.prepair.backend.dto.FeedbackResult;
import com.prepair.backend.dto.PersistedResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Scores an answer for a stored history record and saves the outcome.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HistoryFeedbackService {

    private final EvaluationService evaluationService;
    private final HistoryRecordService historyRecordService;
    private final CompetencyAnalysisService competencyAnalysisService;

    /**
     * First submission of an answer: scores it, marks the history answered
     * and credits the score to the user.
     */
    public PersistedResult scoreAndPersist(Long historyId, String question, String answer) {
        return evaluateAndStore(historyId, question, answer, true);
    }

    /**
     * Re-scores an answer and replaces the stored feedback without crediting
     * points again.
     */
    public PersistedResult regenerate(Long historyId, String question, String answer) {
        return evaluateAndStore(historyId, question, answer, false);
    }

    private PersistedResult evaluateAndStore(Long historyId, String question, String answer, boolean awardPoints) {
        log.info("Evaluating answer for history {} (awardPoints={})", historyId, awardPoints);

        // 1. Fail fast before any model call
        historyRecordService.requireHistory(historyId);

        // 2. Score outside the transaction, model calls are slow
        FeedbackResult result = evaluationService.score(question, answer);

        // 3. Persist history + points atomically
        PersistedResult persisted = historyRecordService.applyResult(historyId, answer, result, awardPoints);

        // 4. Cached competency analysis is stale now
        competencyAnalysisService.invalidate(persisted.getUserId());
        return persisted;
    }
}
