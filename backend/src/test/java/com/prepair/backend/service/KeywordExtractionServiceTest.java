package com.prepair.backend.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepair.backend.config.EvaluationProperties;
import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.exception.ProviderUnavailableException;
import com.prepair.backend.service.provider.GenerationOptions;
import com.prepair.backend.service.provider.GenerationProvider;
import com.prepair.backend.util.CacheKeyBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeywordExtractionServiceTest {

    private static final String QUESTION = "HashMap의 동작 원리를 설명하세요";

    @Mock
    private GenerationProvider generationProvider;

    @Mock
    private CacheService cacheService;

    private KeywordExtractionService service;

    @BeforeEach
    void setUp() {
        OllamaProperties ollamaProperties = new OllamaProperties();
        ollamaProperties.setModel("test-model");
        service = new KeywordExtractionService(generationProvider, new ModelResponseParser(new ObjectMapper()),
                cacheService, ollamaProperties, new EvaluationProperties());
    }

    @SuppressWarnings("unchecked")
    private void cacheMisses() {
        when(cacheService.getOrCompute(eq(CacheKeyBuilder.questionKeywordsKey(QUESTION)), eq(List.class),
                any(Supplier.class), eq(Duration.ofHours(24))))
                .thenAnswer(invocation -> ((Supplier<List<String>>) invocation.getArgument(2)).get());
    }

    @Test
    void shouldExtractKeywords() {
        cacheMisses();
        when(generationProvider.generate(anyString(), anyString(), any(GenerationOptions.class)))
                .thenReturn("{\"keywords\": [\"해시 함수\", \" 버킷 \", \"\", 3, \"충돌 처리\"]}");

        assertThat(service.extractKeywords(QUESTION)).hasValueSatisfying(keywords ->
                assertThat(keywords).containsExactly("해시 함수", "버킷", "충돌 처리"));
    }

    @Test
    void shouldReturnEmptyWhenModelOutputIsUnusable() {
        cacheMisses();
        when(generationProvider.generate(anyString(), anyString(), any(GenerationOptions.class)))
                .thenReturn("{\"keywords\": []}");

        assertThat(service.extractKeywords(QUESTION)).isEmpty();
    }

    @Test
    void shouldReturnEmptyWhenProviderIsDown() {
        cacheMisses();
        when(generationProvider.generate(anyString(), anyString(), any(GenerationOptions.class)))
                .thenThrow(new ProviderUnavailableException("down"));

        assertThat(service.extractKeywords(QUESTION)).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldServeCachedKeywords() {
        when(cacheService.getOrCompute(anyString(), eq(List.class), any(Supplier.class), any(Duration.class)))
                .thenReturn(List.of("해시 함수"));

        assertThat(service.extractKeywords(QUESTION)).contains(List.of("해시 함수"));
        verifyNoInteractions(generationProvider);
    }
}
