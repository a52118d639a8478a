package com.prepair.backend.controller;

import com.prepair.backend.dto.*;
import com.prepair.backend.service.CompetencyAnalysisService;
import com.prepair.backend.service.EvaluationService;
import com.prepair.backend.service.HistoryFeedbackService;
import com.prepair.backend.service.ModelAnswerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/evaluation")
@RequiredArgsConstructor
@Slf4j
public class EvaluationController {

    private final HistoryFeedbackService historyFeedbackService;
    private final EvaluationService evaluationService;
    private final ModelAnswerService modelAnswerService;
    private final CompetencyAnalysisService competencyAnalysisService;

    /**
     * Score an answer and store it on its history record
     * PATCH /api/evaluation/feedback/{historyId}
     */
    @PatchMapping("/feedback/{historyId}")
    public ResponseEntity<PersistedResult> submitAnswer(
            @PathVariable Long historyId,
            @Valid @RequestBody FeedbackRequest request) {

        log.info("Received answer for history {} (questionId={})", historyId, request.getQuestionId());
        return ResponseEntity.ok(
                historyFeedbackService.scoreAndPersist(historyId, request.getQuestion(), request.getAnswer()));
    }

    /**
     * Re-score a stored answer without awarding points again
     * POST /api/evaluation/feedback/{historyId}
     */
    @PostMapping("/feedback/{historyId}")
    public ResponseEntity<PersistedResult> regenerateFeedback(
            @PathVariable Long historyId,
            @Valid @RequestBody FeedbackRequest request) {

        log.info("Regenerating feedback for history {}", historyId);
        return ResponseEntity.ok(
                historyFeedbackService.regenerate(historyId, request.getQuestion(), request.getAnswer()));
    }

    /**
     * Score without persisting
     * POST /api/evaluation/score
     */
    @PostMapping("/score")
    public ResponseEntity<FeedbackResult> score(@Valid @RequestBody ScoreRequest request) {
        return ResponseEntity.ok(evaluationService.score(request.getQuestion(), request.getAnswer()));
    }

    /**
     * Model answer for a question
     * POST /api/evaluation/feedback
     */
    @PostMapping("/feedback")
    public ResponseEntity<ModelAnswerResponse> modelAnswer(@Valid @RequestBody ModelAnswerRequest request) {
        return ResponseEntity.ok(modelAnswerService.answer(request.getQuestion()));
    }

    /**
     * Six-axis competency analysis of a user's recent answers
     * GET /api/evaluation/analysis/{userId}
     */
    @GetMapping("/analysis/{userId}")
    public ResponseEntity<PersonalAnalysis> analysis(@PathVariable Long userId) {
        return ResponseEntity.ok(competencyAnalysisService.analyze(userId));
    }
}
