package com.prepair.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.dto.CompetencyScores;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.dto.PersonalAnalysis;
import com.prepair.backend.entity.History;
import com.prepair.backend.exception.InsufficientHistoryException;
import com.prepair.backend.exception.RecordNotFoundException;
import com.prepair.backend.repository.HistoryRepository;
import com.prepair.backend.repository.UserRepository;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import com.prepair.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.ObjIntConsumer;

/**
 * Rates a user on six competency axes from their recent answers.
 *
 * Unlike narrative feedback there is no neutral fallback: scores carry
 * meaning, so a failed generation is reported to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CompetencyAnalysisService {

    static final List<String> REQUIRED_FIELDS = List.of("scores", "strengths", "improvements", "recommendations");

    private static final Map<String, ObjIntConsumer<CompetencyScores>> AXES = Map.of(
            "logicalThinking", CompetencyScores::setLogicalThinking,
            "communication", CompetencyScores::setCommunication,
            "technicalDepth", CompetencyScores::setTechnicalDepth,
            "problemSolving", CompetencyScores::setProblemSolving,
            "proactiveness", CompetencyScores::setProactiveness,
            "growthPotential", CompetencyScores::setGrowthPotential
    );

    private final UserRepository userRepository;
    private final HistoryRepository historyRepository;
    private final GenerationProvider generationProvider;
    private final ModelResponseParser parser;
    private final RetryExecutor retryExecutor;
    private final CacheService cacheService;
    private final OllamaProperties ollamaProperties;
    private final EvaluationProperties properties;

    public PersonalAnalysis analyze(Long userId) {
        if (!userRepository.existsById(userId)) {
            throw new RecordNotFoundException("User", userId);
        }
        return cacheService.getOrCompute(
                CacheKeyBuilder.competencyAnalysisKey(userId),
                PersonalAnalysis.class,
                () -> computeAnalysis(userId),
                properties.getAnalysis().getCacheTtl()
        );
    }

    public void invalidate(Long userId) {
        cacheService.invalidate(CacheKeyBuilder.competencyAnalysisKey(userId));
    }

    private PersonalAnalysis computeAnalysis(Long userId) {
        EvaluationProperties.Analysis config = properties.getAnalysis();
        List<History> histories = historyRepository.findRecentByUserAndStatus(
                userId, History.HistoryStatus.ANSWERED, PageRequest.of(0, config.getHistoryLimit()));
        if (histories.isEmpty()) {
            throw new InsufficientHistoryException(userId);
        }

        double averageScore = histories.stream()
                .mapToInt(h -> h.getScore() == null ? 0 : h.getScore())
                .average()
                .orElse(0.0);
        boolean lowConfidence = histories.size() < config.getLowConfidenceThreshold();
        log.info("Analysing {} answers of user {} (avg={}, lowConfidence={})",
                histories.size(), userId, averageScore, lowConfidence);

        String prompt = buildPrompt(histories, averageScore, lowConfidence);
        GenerationOptions options = GenerationOptions.builder()
                .temperature(0.3)
                .maxOutputTokens(config.getMaxOutputTokens())
                .jsonFormat(true)
                .build();

        PersonalAnalysis analysis = retryExecutor.execute("Competency analysis", config.getMaxRetries(),
                () -> parser.extractObject(generationProvider.generate(ollamaProperties.getModel(), prompt, options),
                                REQUIRED_FIELDS)
                        .flatMap(CompetencyAnalysisService::toAnalysis));

        analysis.setAnswerCount(histories.size());
        analysis.setAverageScore(Math.round(averageScore * 10) / 10.0);
        analysis.setLowConfidence(lowConfidence);
        return analysis;
    }

    static ParseResult<PersonalAnalysis> toAnalysis(JsonNode node) {
        JsonNode scoresNode = node.get("scores");
        if (!scoresNode.isObject()) {
            return ParseResult.failure("scores is not an object");
        }

        CompetencyScores scores = new CompetencyScores();
        for (Map.Entry<String, ObjIntConsumer<CompetencyScores>> axis : AXES.entrySet()) {
            JsonNode value = scoresNode.get(axis.getKey());
            if (value == null || !(value.isNumber() || isNumericText(value))) {
                return ParseResult.failure("Missing or non-numeric score: " + axis.getKey());
            }
            axis.getValue().accept(scores, CompetencyScores.clamp(value.asDouble()));
        }

        String strengths = text(node, "strengths");
        String improvements = text(node, "improvements");
        String recommendations = text(node, "recommendations");
        if (strengths == null || improvements == null || recommendations == null) {
            return ParseResult.failure("Analysis has an empty text field");
        }

        return ParseResult.parsed(PersonalAnalysis.builder()
                .scores(scores)
                .strengths(strengths)
                .improvements(improvements)
                .recommendations(recommendations)
                .build());
    }

    private static boolean isNumericText(JsonNode value) {
        if (!value.isTextual()) {
            return false;
        }
        try {
            Double.parseDouble(value.asText().trim());
            return true;
        } catch (NumberFormatException e) {
            return false;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            return null;
        }
        return value.asText().trim();
    }

    private static String buildPrompt(List<History> histories, double averageScore, boolean lowConfidence) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("당신은 엄격한 기술 면접 평가관입니다. 아래 지원자의 면접 답변 기록을 보고 역량을 평가하세요.\n\n");

        for (int i = 0; i < histories.size(); i++) {
            History history = histories.get(i);
            prompt.append(String.format("Q%d: %s\n", i + 1, history.getQuestion()));
            prompt.append(String.format("A%d: %s\n", i + 1, history.getAnswer()));
            prompt.append(String.format("점수%d: %d/100\n\n", i + 1, history.getScore() == null ? 0 : history.getScore()));
        }

        prompt.append(String.format("답변 수: %d, 평균 점수: %.1f/100\n", histories.size(), averageScore));
        if (lowConfidence) {
            prompt.append("답변 수가 적으므로 극단적인 점수(0~2, 9~10)를 피하고 보수적으로 평가하세요.\n");
        }

        prompt.append("""

                평가 기준 (각 항목 0~10의 정수):
                - logicalThinking (논리적 사고): 주장과 근거의 연결, 답변 구조의 일관성
                - communication (의사소통): 명확한 용어 사용, 간결하고 이해하기 쉬운 설명
                - technicalDepth (기술 깊이): 개념의 정확성, 원리와 내부 동작에 대한 이해
                - problemSolving (문제 해결): 상황 분석, 대안 비교, 해결 방법 제시
                - proactiveness (적극성): 질문 이상의 내용 보완, 경험과 사례 제시
                - growthPotential (성장 가능성): 부족한 점 인식, 학습 의지, 답변 간 향상

                점수 구간:
                - 0~2: 해당 역량이 답변에서 거의 드러나지 않음, 오류나 무응답이 대부분
                - 3~4: 기초적인 수준, 핵심이 자주 누락되거나 부정확함
                - 5~6: 평균 수준, 핵심은 다루지만 깊이나 근거가 부족함
                - 7~8: 우수, 정확하고 근거가 있으며 대부분의 답변에서 일관됨
                - 9~10: 탁월, 모든 답변에서 깊이 있고 정확하며 실무 사례까지 제시함
                평균 점수와 크게 어긋나는 점수를 주지 마세요.

                다른 설명 없이 다음 JSON 형식으로만 응답하세요:
                {
                  "scores": {"logicalThinking": 0, "communication": 0, "technicalDepth": 0, "problemSolving": 0, "proactiveness": 0, "growthPotential": 0},
                  "strengths": "강점 (2~3문장)",
                  "improvements": "개선할 점 (2~3문장)",
                  "recommendations": "추천 학습 방향 (2~3문장)"
                }
                """);
        return prompt.toString();
    }
}
