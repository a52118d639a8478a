package com.prepair.backend.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.prepair.backend.dto.ParseResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls a JSON object out of free-form model output.
 *
 * Tried in order: the trimmed body itself, the first fenced code block, and
 * the first balanced {@code {...}} span that mentions every required field.
 * Only objects carrying all required field names are accepted.
 */
@Component
@Slf4j
public class ModelResponseParser {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```(?:json|JSON)?\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;
    private final ObjectMapper lenientMapper;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.lenientMapper = objectMapper.copy()
                .configure(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature(), true)
                .configure(JsonReadFeature.ALLOW_BACKSLASH_ESCAPING_ANY_CHARACTER.mappedFeature(), true)
                .configure(JsonReadFeature.ALLOW_SINGLE_QUOTES.mappedFeature(), true)
                .configure(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature(), true);
    }

    public ParseResult<JsonNode> extractObject(String raw, List<String> requiredFields) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.failure("Empty model output");
        }
        String trimmed = raw.trim();

        // 1. whole body
        if (trimmed.startsWith("{") && trimmed.endsWith("}")) {
            ParseResult<JsonNode> direct = readObject(trimmed, requiredFields);
            if (direct.isParsed()) {
                return direct;
            }
        }

        // 2. fenced code block
        Matcher fence = FENCED_BLOCK.matcher(trimmed);
        if (fence.find()) {
            ParseResult<JsonNode> fenced = readObject(fence.group(1).trim(), requiredFields);
            if (fenced.isParsed()) {
                return fenced;
            }
        }

        // 3. first span that names every required field
        for (int start = trimmed.indexOf('{'); start >= 0; start = trimmed.indexOf('{', start + 1)) {
            int end = matchingBrace(trimmed, start);
            if (end < 0) {
                continue;
            }
            String candidate = trimmed.substring(start, end + 1);
            if (mentionsAll(candidate, requiredFields)) {
                ParseResult<JsonNode> embedded = readObject(candidate, requiredFields);
                if (embedded.isParsed()) {
                    return embedded;
                }
            }
        }

        log.debug("No JSON object with fields {} in model output: {}", requiredFields, summarize(trimmed));
        return ParseResult.failure("No JSON object with fields " + requiredFields);
    }

    private ParseResult<JsonNode> readObject(String json, List<String> requiredFields) {
        JsonNode node;
        try {
            node = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            try {
                node = lenientMapper.readTree(json);
            } catch (JsonProcessingException lenientFailure) {
                return ParseResult.failure("Malformed JSON: " + lenientFailure.getOriginalMessage());
            }
        }
        if (node == null || !node.isObject()) {
            return ParseResult.failure("JSON is not an object");
        }
        for (String field : requiredFields) {
            if (!node.hasNonNull(field)) {
                return ParseResult.failure("Missing field: " + field);
            }
        }
        return ParseResult.parsed(node);
    }

    /**
     * Index of the brace closing the one at {@code start}, skipping braces
     * inside string literals; -1 when unbalanced.
     */
    static int matchingBrace(String text, int start) {
        int depth = 0;
        boolean inString = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\\') {
                    i++;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static boolean mentionsAll(String candidate, List<String> fields) {
        for (String field : fields) {
            if (!candidate.contains("\"" + field + "\"") && !candidate.contains("'" + field + "'")) {
                return false;
            }
        }
        return true;
    }

    static String summarize(String content) {
        String s = content.replaceAll("\\s+", " ").trim();
        return s.length() <= 200 ? s : s.substring(0, 200) + "...";
    }
}
