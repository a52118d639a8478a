package com.prepair.backend.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.dto.ParseResult;
import com.prepair.backend.exception.ProviderUnavailableException;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import com.prepair.backend.util.CacheKeyBuilder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Asks the generation model for the key concepts an ideal answer to a
 * question should mention. The joined keywords are embedded as the
 * reference the answer is compared against.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KeywordExtractionService {

    private static final List<String> REQUIRED_FIELDS = List.of("keywords");

    private final GenerationProvider generationProvider;
    private final ModelResponseParser parser;
    private final CacheService cacheService;
    private final OllamaProperties ollamaProperties;
    private final EvaluationProperties properties;

    /**
     * @return the keywords, or empty when the model gave nothing usable
     */
    @SuppressWarnings("unchecked")
    public Optional<List<String>> extractKeywords(String question) {
        List<String> keywords = cacheService.getOrCompute(
                CacheKeyBuilder.questionKeywordsKey(question),
                List.class,
                () -> requestKeywords(question),
                properties.getKeywords().getCacheTtl()
        );
        return Optional.ofNullable(keywords).filter(list -> !list.isEmpty());
    }

    private List<String> requestKeywords(String question) {
        String raw;
        try {
            raw = generationProvider.generate(
                    ollamaProperties.getModel(),
                    buildPrompt(question),
                    GenerationOptions.builder()
                            .temperature(0.2)
                            .maxOutputTokens(properties.getKeywords().getMaxOutputTokens())
                            .jsonFormat(true)
                            .build());
        } catch (ProviderUnavailableException e) {
            log.warn("⚠️ Keyword extraction unavailable: {}", e.getMessage());
            return null;
        }

        ParseResult<List<String>> result = parser.extractObject(raw, REQUIRED_FIELDS)
                .flatMap(KeywordExtractionService::toKeywords);
        if (!result.isParsed()) {
            log.warn("⚠️ Keyword extraction returned unusable output: {}", result.getFailureReason());
            return null;
        }
        return result.getValue();
    }

    private static ParseResult<List<String>> toKeywords(JsonNode node) {
        JsonNode array = node.get("keywords");
        if (!array.isArray()) {
            return ParseResult.failure("keywords is not an array");
        }
        List<String> keywords = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && !item.asText().isBlank()) {
                keywords.add(item.asText().trim());
            }
        }
        return keywords.isEmpty() ? ParseResult.failure("keywords is empty") : ParseResult.parsed(keywords);
    }

    private static String buildPrompt(String question) {
        return """
                당신은 기술 면접관입니다. 아래 면접 질문에 대한 모범 답변이 반드시 언급해야 하는 핵심 개념을 추출하세요.
                - 5~10개의 짧은 명사구로 작성하세요.
                - 질문에 이미 나온 단어만 반복하지 말고 답변에 필요한 개념을 포함하세요.
                다른 설명 없이 다음 JSON 형식으로만 응답하세요:
                {"keywords": ["개념1", "개념2"]}

                질문: %s
                """.formatted(question);
    }
}
