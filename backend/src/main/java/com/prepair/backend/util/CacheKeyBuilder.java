package com.prepair.backend.util;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

public class CacheKeyBuilder {

    private static final String SEPARATOR = ":";

    // Reference keywords of a question (keyed by content, questions are shared across users)
    public static String questionKeywordsKey(String question) {
        String digest = UUID.nameUUIDFromBytes(question.trim().getBytes(StandardCharsets.UTF_8)).toString();
        return String.format("question_keywords%s%s", SEPARATOR, digest);
    }

    // Competency analysis of a user
    public static String competencyAnalysisKey(Long userId) {
        return String.format("competency_analysis%s%d", SEPARATOR, userId);
    }
}
