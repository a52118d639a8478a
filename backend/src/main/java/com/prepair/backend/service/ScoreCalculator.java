package com.prepair.backend.service;

import com.prepair.backend.dto.EvaluationIssue;
import com.prepair.backend.util.LexicalAnalyzer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Sub-scores and penalties of the answer score. Stateless; issues are
 * appended to the caller's list in the order they are found.
 */
@Component
@RequiredArgsConstructor
public class ScoreCalculator {

    public static final double MAX_RELEVANCE = 25.0;
    public static final double MAX_SEMANTIC = 40.0;
    public static final double MAX_QUALITY = 35.0;

    private static final Pattern SENTENCE_SPLIT = Pattern.compile("[.!?]+");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern BULLET = Pattern.compile("(?m)^\\s*([-*•·]|\\d+[.)])\\s+");

    private static final String[] EXAMPLE_PHRASES = {
            "예를 들어", "예를들어", "예를 들면", "예컨대", "예시", "가령", "for example", "for instance", "e.g.", "such as"
    };

    private static final Pattern[] COMPLEX_QUESTION_PATTERNS = {
            Pattern.compile("(무엇|어떤).*(왜|이유)"),
            Pattern.compile("(왜|이유).*(무엇|어떤)"),
            Pattern.compile("(무엇|어떤).*(차이|비교)"),
            Pattern.compile("차이"),
            Pattern.compile("나열"),
            Pattern.compile("(?i)\\b(difference|compare|list)\\b"),
            Pattern.compile("\\?.*\\?", Pattern.DOTALL)
    };

    private static final Pattern DEMANDS_SPECIFICS = Pattern.compile(
            "(?i)(무엇|어떤|나열|설명|종류|방법|\\bwhat\\b|\\bwhich\\b|\\blist\\b|\\bexplain\\b|\\bdescribe\\b|\\btypes?\\b|\\bhow\\b)");

    private final LexicalAnalyzer lexicalAnalyzer;

    // ==================== SUB-SCORES ====================

    /**
     * 15 points for keyword match ratio plus 10 points for topic similarity
     * mapped linearly from [0.2, 0.5].
     */
    public double relevance(double keywordMatchRatio, double topicSimilarity) {
        double keywordPart = 15.0 * clamp(keywordMatchRatio, 0.0, 1.0);
        double similarityPart = clamp((topicSimilarity - 0.2) / 0.3 * 10.0, 0.0, 10.0);
        return keywordPart + similarityPart;
    }

    /**
     * Piecewise-linear mapping of answer-to-reference similarity onto [0, 40].
     */
    public double semantic(double similarity) {
        double score;
        if (similarity < 0.3) {
            score = similarity * 33.33;
        } else if (similarity < 0.45) {
            score = 10.0 + (similarity - 0.3) * 100.0;
        } else if (similarity < 0.6) {
            score = 25.0 + (similarity - 0.45) * 66.67;
        } else {
            score = 35.0 + Math.min(5.0, (similarity - 0.6) * 12.5);
        }
        return clamp(score, 0.0, MAX_SEMANTIC);
    }

    public double quality(String answer) {
        String text = answer == null ? "" : answer.trim();
        return lengthTier(text.length()) + sentenceTier(countSentences(text)) + specificity(text);
    }

    static int lengthTier(int length) {
        if (length < 20) return 5;
        if (length < 50) return 10;
        if (length < 80) return 13;
        return 15;
    }

    static int sentenceTier(int sentences) {
        if (sentences <= 1) return 5;
        if (sentences < 3) return 8;
        if (sentences <= 5) return 10;
        return 9;
    }

    static int countSentences(String text) {
        return (int) Arrays.stream(SENTENCE_SPLIT.split(text))
                .filter(s -> !s.isBlank())
                .count();
    }

    int specificity(String text) {
        int score = 5;
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : EXAMPLE_PHRASES) {
            if (lower.contains(phrase)) {
                score += 2;
                break;
            }
        }
        if (DIGIT.matcher(text).find()) {
            score += 2;
        }
        if (lexicalAnalyzer.tokenize(text).stream().anyMatch(token -> token.length() >= 5)) {
            score += 3;
        }
        return Math.min(score, 10);
    }

    /**
     * +5 when one word of more than two characters is used more than seven
     * times, +15 when the answer has fewer than five words.
     */
    public double penalty(String answer, List<String> issues) {
        List<String> tokens = lexicalAnalyzer.tokenize(answer);
        double penalty = 0.0;

        Map<String, Integer> counts = new HashMap<>();
        for (String token : tokens) {
            if (token.length() > 2) {
                counts.merge(token, 1, Integer::sum);
            }
        }
        if (counts.values().stream().anyMatch(count -> count > 7)) {
            penalty += 5.0;
            issues.add(EvaluationIssue.REPETITIVE_WORDING);
        }
        if (tokens.size() < 5) {
            penalty += 15.0;
            issues.add(EvaluationIssue.TOO_FEW_WORDS);
        }
        return penalty;
    }

    // ==================== CAPS AND ADJUSTMENTS ====================

    /**
     * Upper bound for the score of an answer of the given trimmed length;
     * non-increasing as answers get shorter.
     */
    public static int lengthCap(int trimmedLength) {
        if (trimmedLength < 50) return 45;
        if (trimmedLength < 80) return 50;
        if (trimmedLength < 120) return 60;
        if (trimmedLength < 150) return 70;
        if (trimmedLength < 200) return 80;
        return 100;
    }

    public static boolean isComplexQuestion(String question) {
        for (Pattern pattern : COMPLEX_QUESTION_PATTERNS) {
            if (pattern.matcher(question).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Points to subtract for answers that are too thin for what the question
     * asks. Each rule triggers independently.
     */
    public int keywordPenalty(String question, String answer, double coverage, int questionKeywordCount,
                              List<String> issues) {
        String text = answer.trim();
        int penalty = 0;

        if (isComplexQuestion(question)) {
            if (text.length() < 150) {
                penalty += 10;
                addOnce(issues, EvaluationIssue.LACKS_DETAIL);
            }
            if (coverage < 0.3) {
                penalty += 15;
                addOnce(issues, EvaluationIssue.LOW_KEYWORD_COVERAGE);
            }
        }

        if (DEMANDS_SPECIFICS.matcher(question).find() && !hasSpecifics(text)) {
            penalty += 10;
            addOnce(issues, EvaluationIssue.LACKS_DETAIL);
        }

        if (coverage < 0.2 && questionKeywordCount >= 3) {
            penalty += 5;
            addOnce(issues, EvaluationIssue.LOW_KEYWORD_COVERAGE);
        }
        return penalty;
    }

    private boolean hasSpecifics(String text) {
        return DIGIT.matcher(text).find()
                || BULLET.matcher(text).find()
                || lexicalAnalyzer.tokenize(text).stream().anyMatch(token -> token.length() > 5);
    }

    private static void addOnce(List<String> issues, String issue) {
        if (!issues.contains(issue)) {
            issues.add(issue);
        }
    }

    static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
