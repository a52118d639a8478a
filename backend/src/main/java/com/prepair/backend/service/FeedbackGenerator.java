package com.prepair.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.dto.NarrativeFeedback;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.exception.GenerationFailedException;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Writes the narrative part of the feedback once the score is final.
 *
 * When the model cannot produce a complete {good, improvement,
 * recommendation} triple within the retry budget, a fixed neutral triple
 * is returned instead of failing the evaluation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FeedbackGenerator {

    static final List<String> REQUIRED_FIELDS = List.of("good", "improvement", "recommendation");

    static final String FALLBACK_GOOD = "답변을 제출해 주셔서 감사합니다. 질문에 답하려는 시도가 확인되었습니다.";
    static final String FALLBACK_IMPROVEMENT = "핵심 개념을 정확한 용어로 설명하고, 근거와 함께 논리적으로 정리해 보세요.";
    static final String FALLBACK_RECOMMENDATION = "구체적인 예시나 경험을 덧붙여 답변의 설득력을 높이는 연습을 해 보세요.";

    private final GenerationProvider generationProvider;
    private final ModelResponseParser parser;
    private final RetryExecutor retryExecutor;
    private final OllamaProperties ollamaProperties;
    private final EvaluationProperties properties;

    /**
     * @return generated feedback, or a fresh neutral copy flagged
     *         {@link NarrativeFeedback#isFallback()} when generation failed
     */
    public NarrativeFeedback generate(String question, String answer, int score, List<String> issues) {
        String prompt = buildPrompt(question, answer, score, issues);
        GenerationOptions options = GenerationOptions.prose(properties.getFeedback().getMaxOutputTokens());

        try {
            return retryExecutor.execute("Feedback generation", properties.getFeedback().getMaxRetries(),
                    () -> parser.extractObject(generationProvider.generate(ollamaProperties.getModel(), prompt, options),
                                    REQUIRED_FIELDS)
                            .flatMap(FeedbackGenerator::toFeedback));
        } catch (GenerationFailedException e) {
            log.warn("⚠️ Using fallback feedback: {}", e.getMessage());
            return fallbackFeedback();
        }
    }

    static NarrativeFeedback fallbackFeedback() {
        return NarrativeFeedback.fallback(FALLBACK_GOOD, FALLBACK_IMPROVEMENT, FALLBACK_RECOMMENDATION);
    }

    static ParseResult<NarrativeFeedback> toFeedback(JsonNode node) {
        NarrativeFeedback feedback = new NarrativeFeedback(
                text(node, "good"), text(node, "improvement"), text(node, "recommendation"));
        return feedback.isComplete()
                ? ParseResult.parsed(feedback)
                : ParseResult.failure("Feedback has an empty field");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText().trim() : null;
    }

    private static String buildPrompt(String question, String answer, int score, List<String> issues) {
        String issueLines = issues.isEmpty() ? "없음" : String.join(", ", issues);
        return """
                당신은 친절하지만 정확한 기술 면접 코치입니다. 지원자의 답변을 읽고 피드백을 작성하세요.

                질문: %s
                답변: %s
                평가 점수: %d / 100
                감지된 문제: %s

                작성 규칙:
                - good: 답변에서 잘한 점 (1~2문장)
                - improvement: 부족한 점과 보완할 내용 (1~3문장)
                - recommendation: 다음 답변을 위한 구체적인 학습/연습 방법 (1~2문장)
                - 점수와 감지된 문제를 반영하고, 답변에 없는 내용을 칭찬하지 마세요.

                다른 설명 없이 다음 JSON 형식으로만 응답하세요:
                {"good": "...", "improvement": "...", "recommendation": "..."}
                """.formatted(question, answer, score, issueLines);
    }
}
