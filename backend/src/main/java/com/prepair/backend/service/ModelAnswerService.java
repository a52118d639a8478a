package com.prepair.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.dto.ModelAnswerResponse;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Generates a concise model answer for an interview question.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ModelAnswerService {

    private static final List<String> REQUIRED_FIELDS = List.of("answer");

    private final GenerationProvider generationProvider;
    private final ModelResponseParser parser;
    private final RetryExecutor retryExecutor;
    private final OllamaProperties ollamaProperties;
    private final EvaluationProperties properties;

    /**
     * @throws com.prepair.backend.exception.GenerationFailedException when no usable answer was generated
     */
    public ModelAnswerResponse answer(String question) {
        log.info("Generating model answer for question: {}", question);
        String prompt = buildPrompt(question);
        GenerationOptions options = GenerationOptions.prose(properties.getFeedback().getMaxOutputTokens());

        String answer = retryExecutor.execute("Model answer", properties.getFeedback().getMaxRetries(),
                () -> parser.extractObject(generationProvider.generate(ollamaProperties.getModel(), prompt, options),
                                REQUIRED_FIELDS)
                        .flatMap(ModelAnswerService::toAnswer));
        return new ModelAnswerResponse(question, answer);
    }

    static ParseResult<String> toAnswer(JsonNode node) {
        JsonNode value = node.get("answer");
        if (!value.isTextual() || value.asText().isBlank()) {
            return ParseResult.failure("answer is empty");
        }
        return ParseResult.parsed(value.asText().trim());
    }

    private static String buildPrompt(String question) {
        return """
                당신은 기술 면접을 준비하는 지원자를 돕는 멘토입니다.
                아래 질문에 대한 모범 답변을 면접에서 말하듯 3~5문장으로 간결하게 작성하세요.
                핵심 개념을 정확한 용어로 설명하고, 가능하면 짧은 예시를 포함하세요.

                질문: %s

                다른 설명 없이 다음 JSON 형식으로만 응답하세요:
                {"answer": "..."}
                """.formatted(question);
    }
}
