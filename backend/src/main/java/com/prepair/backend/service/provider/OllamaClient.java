package com.prepair.backend.service.provider;

import com.prepair.backend.config.OllamaProperties;
import com.prepair.backend.exception.ProviderUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Embedding and generation calls against an Ollama server.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OllamaClient implements EmbeddingProvider, GenerationProvider {

    private static final String GENERATE_PATH = "/api/generate";
    private static final String EMBED_PATH = "/api/embed";
    private static final float[] EMPTY = new float[0];

    private final RestTemplate restTemplate;
    private final OllamaProperties properties;

    // ==================== EMBEDDINGS ====================

    @Override
    public float[] embed(String model, String text) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("input", text);

        try {
            Map<?, ?> responseBody = post(EMBED_PATH, requestBody);
            if (responseBody == null || !(responseBody.get("embeddings") instanceof List<?> embeddings)
                    || embeddings.isEmpty() || !(embeddings.get(0) instanceof List<?> values)) {
                log.warn("⚠️ Ollama embed returned no vector (model={})", model);
                return EMPTY;
            }
            return toFloatArray(values);
        } catch (RestClientException e) {
            log.warn("⚠️ Ollama embed call failed (model={}): {}", model, e.getMessage());
            return EMPTY;
        }
    }

    // ==================== GENERATION ====================

    @Override
    public String generate(String model, String prompt, GenerationOptions options) {
        Map<String, Object> requestBody = new HashMap<>();
        requestBody.put("model", model);
        requestBody.put("prompt", prompt);
        requestBody.put("stream", false);
        if (options.isJsonFormat()) {
            requestBody.put("format", "json");
        }

        Map<String, Object> modelOptions = new HashMap<>();
        modelOptions.put("temperature", options.getTemperature());
        if (options.getMaxOutputTokens() != null) {
            modelOptions.put("num_predict", options.getMaxOutputTokens());
        }
        requestBody.put("options", modelOptions);

        Map<?, ?> responseBody;
        try {
            responseBody = post(GENERATE_PATH, requestBody);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException("Ollama generate call failed", e);
        }

        if (responseBody == null || !(responseBody.get("response") instanceof String text) || text.isBlank()) {
            throw new ProviderUnavailableException("Empty response from Ollama (model=" + model + ")");
        }
        return text;
    }

    // ==================== HTTP ====================

    private Map<?, ?> post(String path, Map<String, Object> requestBody) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(requestBody, headers);
        return restTemplate.postForEntity(properties.getHost() + path, entity, Map.class).getBody();
    }

    private static float[] toFloatArray(List<?> values) {
        float[] vector = new float[values.size()];
        for (int i = 0; i < values.size(); i++) {
            if (!(values.get(i) instanceof Number number)) {
                log.warn("⚠️ Non-numeric embedding component at index {}", i);
                return EMPTY;
            }
            vector[i] = number.floatValue();
        }
        return vector;
    }
}
