package com.prepair.backend.service;

import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.dto.CopyDetectionVerdict;
import com.prepair.backend.dto.EvaluationIssue;
import com.prepair.backend.dto.FeedbackResult;
import com.prepair.backend.dto.NarrativeFeedback;
import com.prepair.backend.dto.ScoreBreakdown;
import com.prepair.backend.service.provider.EmbeddingProvider;
import com.prepair.backend.util.CopyDetector;
import com.prepair.backend.util.DegenerateAnswerDetector;
import com.prepair.backend.util.LexicalAnalyzer;
import com.prepair.backend.util.VectorMath;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Scores one answer to one question.
 *
 * Gates run first and may end the pass early with a fixed score:
 * length, degenerate input, topic similarity, copy detection. Answers that
 * pass every gate get relevance, semantic and quality sub-scores, then the
 * length cap, keyword penalties and the completeness check. Narrative
 * feedback is generated last, for the final score.
 */
@Service
@Slf4j
public class EvaluationService {

    static final int MIN_ANSWER_LENGTH = 10;
    static final double TOPIC_GATE = 0.25;
    static final double TOPIC_ZERO = 0.15;
    static final int INCOMPLETE_PENALTY = 20;

    private static final float[] EMPTY = new float[0];

    private final EmbeddingProvider embeddingProvider;
    private final KeywordExtractionService keywordExtractionService;
    private final LexicalAnalyzer lexicalAnalyzer;
    private final DegenerateAnswerDetector degenerateAnswerDetector;
    private final CopyDetector copyDetector;
    private final ScoreCalculator scoreCalculator;
    private final CompletenessJudge completenessJudge;
    private final FeedbackGenerator feedbackGenerator;
    private final OllamaProperties ollamaProperties;
    private final EvaluationProperties properties;
    private final Executor evaluationExecutor;

    public EvaluationService(EmbeddingProvider embeddingProvider,
                             KeywordExtractionService keywordExtractionService,
                             LexicalAnalyzer lexicalAnalyzer,
                             DegenerateAnswerDetector degenerateAnswerDetector,
                             CopyDetector copyDetector,
                             ScoreCalculator scoreCalculator,
                             CompletenessJudge completenessJudge,
                             FeedbackGenerator feedbackGenerator,
                             OllamaProperties ollamaProperties,
                             EvaluationProperties properties,
                             @Qualifier("evaluationExecutor") Executor evaluationExecutor) {
        this.embeddingProvider = embeddingProvider;
        this.keywordExtractionService = keywordExtractionService;
        this.lexicalAnalyzer = lexicalAnalyzer;
        this.degenerateAnswerDetector = degenerateAnswerDetector;
        this.copyDetector = copyDetector;
        this.scoreCalculator = scoreCalculator;
        this.completenessJudge = completenessJudge;
        this.feedbackGenerator = feedbackGenerator;
        this.ollamaProperties = ollamaProperties;
        this.properties = properties;
        this.evaluationExecutor = evaluationExecutor;
    }

    public FeedbackResult score(String question, String answer) {
        String trimmed = answer == null ? "" : answer.trim();
        List<String> issues = new ArrayList<>();
        log.info("Scoring answer (length={}): {}", trimmed.length(), preview(trimmed));

        // 1. length gate
        if (trimmed.length() < MIN_ANSWER_LENGTH) {
            issues.add(EvaluationIssue.ANSWER_TOO_SHORT);
            return FeedbackResult.rejected(0, "답변이 너무 짧습니다. 최소 " + MIN_ANSWER_LENGTH + "자 이상 작성해 주세요.", issues);
        }

        // 2. degenerate gate
        if (degenerateAnswerDetector.isMeaningless(trimmed)) {
            issues.add(EvaluationIssue.MEANINGLESS_ANSWER);
            return FeedbackResult.rejected(0, "의미 있는 내용으로 답변해 주세요.", issues);
        }

        // 3. embeddings + topic gate
        Embeddings embeddings = embedAll(question, trimmed);
        double topicSimilarity = VectorMath.cosineSimilarity(embeddings.question, embeddings.answer);
        log.debug("Topic similarity: {}", topicSimilarity);
        if (topicSimilarity < TOPIC_GATE) {
            int score = topicSimilarity < TOPIC_ZERO ? 0 : (int) Math.round(topicSimilarity * 20);
            issues.add(EvaluationIssue.OFF_TOPIC);
            return FeedbackResult.rejected(score, "질문과 관련된 내용으로 답변해 주세요.", issues);
        }

        // 4. copy gate
        CopyDetectionVerdict verdict = copyDetector.detect(question, trimmed);
        if (verdict.isCopied()) {
            log.info("Copied answer rejected: {} (ratio={})", verdict.getReason(), verdict.getCopyRatio());
            issues.add(EvaluationIssue.COPIED_QUESTION);
            return FeedbackResult.rejected(0, "질문을 옮겨 적은 답변은 평가할 수 없습니다 (" + verdict.getReason() + "). 자신의 말로 답변해 주세요.", issues);
        }

        // 5. sub-scores
        List<String> questionKeywords = lexicalAnalyzer.extractKeywords(question);
        double coverage = lexicalAnalyzer.keywordCoverage(question, trimmed);
        double referenceSimilarity = VectorMath.cosineSimilarity(embeddings.answer, embeddings.reference);

        ScoreBreakdown breakdown = ScoreBreakdown.builder()
                .relevanceScore(scoreCalculator.relevance(coverage, topicSimilarity))
                .semanticScore(scoreCalculator.semantic(referenceSimilarity))
                .qualityScore(scoreCalculator.quality(trimmed))
                .penalty(scoreCalculator.penalty(trimmed, issues))
                .build();
        int finalScore = clampScore(Math.round(breakdown.rawScore()));
        log.debug("Score breakdown: {} -> {}", breakdown, finalScore);

        // 6. length cap
        int cap = ScoreCalculator.lengthCap(trimmed.length());
        if (finalScore > cap) {
            finalScore = cap;
            issues.add(EvaluationIssue.LENGTH_CAPPED);
        }

        // 7. keyword / complexity penalties
        finalScore -= scoreCalculator.keywordPenalty(question, trimmed, coverage, questionKeywords.size(), issues);

        // 8. completeness
        if (!completenessJudge.isComplete(question, trimmed)) {
            finalScore -= INCOMPLETE_PENALTY;
            issues.add(EvaluationIssue.INCOMPLETE_ANSWER);
        }
        finalScore = clampScore(finalScore);

        // 9. narrative feedback for the final score
        NarrativeFeedback feedback = feedbackGenerator.generate(question, trimmed, finalScore, issues);
        if (feedback.isFallback()) {
            issues.add(EvaluationIssue.FEEDBACK_FALLBACK);
        }

        log.info("Answer scored {} with issues {}", finalScore, issues);
        return FeedbackResult.builder()
                .score(finalScore)
                .feedback(feedback)
                .issues(List.copyOf(new LinkedHashSet<>(issues)))
                .build();
    }

    /**
     * Question, answer and reference embeddings fetched concurrently. The
     * reference chain first extracts keywords and falls back to the question
     * embedding when none are available.
     */
    private Embeddings embedAll(String question, String answer) {
        String model = ollamaProperties.getEmbeddingModel();

        CompletableFuture<float[]> questionFuture = CompletableFuture.supplyAsync(
                () -> embeddingProvider.embed(model, question), evaluationExecutor);
        CompletableFuture<float[]> answerFuture = CompletableFuture.supplyAsync(
                () -> embeddingProvider.embed(model, answer), evaluationExecutor);
        CompletableFuture<float[]> referenceFuture = CompletableFuture.supplyAsync(
                        () -> keywordExtractionService.extractKeywords(question), evaluationExecutor)
                .exceptionally(e -> {
                    log.warn("⚠️ Keyword extraction failed, using question as reference", e);
                    return Optional.empty();
                })
                .thenCompose(keywords -> keywords
                        .map(list -> CompletableFuture.supplyAsync(
                                () -> embeddingProvider.embed(model, String.join(", ", list)), evaluationExecutor))
                        .orElse(questionFuture));

        return new Embeddings(await(questionFuture, "question"), await(answerFuture, "answer"),
                await(referenceFuture, "reference"));
    }

    private float[] await(CompletableFuture<float[]> future, String name) {
        try {
            float[] vector = future.get(properties.getProviderTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return vector == null ? EMPTY : vector;
        } catch (TimeoutException e) {
            log.warn("⚠️ {} embedding timed out", name);
            future.cancel(true);
        } catch (ExecutionException e) {
            log.warn("⚠️ {} embedding failed", name, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("⚠️ Interrupted while waiting for {} embedding", name);
        }
        return EMPTY;
    }

    static int clampScore(long score) {
        return (int) Math.max(0, Math.min(100, score));
    }

    private static String preview(String text) {
        return text.length() <= 40 ? text : text.substring(0, 40) + "...";
    }

    private static final class Embeddings {
        private final float[] question;
        private final float[] answer;
        private final float[] reference;

        private Embeddings(float[] question, float[] answer, float[] reference) {
            this.question = question;
            this.answer = answer;
            this.reference = reference;
        }
    }
}
