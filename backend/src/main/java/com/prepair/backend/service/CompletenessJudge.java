package com.prepair.backend.service;

import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.exception.ProviderUnavailableException;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Yes/no judgement of whether an answer addresses everything the question
 * explicitly asks for. Any failure or unclear verdict counts as complete.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CompletenessJudge {

    private final GenerationProvider generationProvider;
    private final OllamaProperties ollamaProperties;

    public boolean isComplete(String question, String answer) {
        String verdict;
        try {
            verdict = generationProvider.generate(ollamaProperties.getModel(), buildPrompt(question, answer),
                    GenerationOptions.DETERMINISTIC);
        } catch (ProviderUnavailableException e) {
            log.warn("⚠️ Completeness check unavailable, treating answer as complete: {}", e.getMessage());
            return true;
        }
        return !isNegative(verdict);
    }

    static boolean isNegative(String verdict) {
        if (verdict == null) {
            return false;
        }
        String normalized = verdict.trim().toUpperCase(Locale.ROOT);
        return normalized.startsWith("NO") || normalized.startsWith("아니");
    }

    private static String buildPrompt(String question, String answer) {
        return """
                다음 면접 질문이 명시적으로 요구하는 항목(예: 개수, 비교 대상, 이유, 예시)을 답변이 모두 다루고 있는지 판단하세요.
                답변의 정확성은 판단하지 말고, 요구사항을 다루었는지만 보세요.

                질문: %s
                답변: %s

                YES 또는 NO 한 단어로만 답하세요.
                """.formatted(question, answer);
    }
}
