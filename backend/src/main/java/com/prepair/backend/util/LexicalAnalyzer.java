package com.prepair.backend.util;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenization and keyword coverage for short interview answers.
 */
@Component
@RequiredArgsConstructor
public class LexicalAnalyzer {

    private static final Pattern WORD = Pattern.compile("[\\w\\uAC00-\\uD7A3]+", Pattern.UNICODE_CHARACTER_CLASS);

    // Longest first so "에서" wins over "서"
    private static final String[] TRAILING_PARTICLES = {
            "에서", "으로", "에게", "까지", "부터",
            "은", "는", "이", "가", "을", "를", "의", "에", "도", "로", "와", "과"
    };

    private final Lexicon lexicon;

    /**
     * Lower-cased word tokens in order of appearance.
     */
    public List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        Matcher matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    /**
     * Distinct content words of at least two characters, stop words removed
     * and a trailing Korean particle stripped.
     */
    public List<String> extractKeywords(String text) {
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : tokenize(text)) {
            if (token.length() < 2 || lexicon.isStopWord(token)) {
                continue;
            }
            String stem = stripParticle(token);
            if (stem.length() >= 2 && !lexicon.isStopWord(stem)) {
                keywords.add(stem);
            }
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Share of the question's keywords that occur in the answer. A question
     * without keywords is fully covered.
     */
    public double keywordCoverage(String question, String answer) {
        List<String> keywords = extractKeywords(question);
        if (keywords.isEmpty()) {
            return 1.0;
        }
        return (double) countMatched(keywords, answer) / keywords.size();
    }

    public int countMatched(List<String> keywords, String answer) {
        if (answer == null || answer.isEmpty()) {
            return 0;
        }
        String haystack = answer.toLowerCase(Locale.ROOT);
        int matched = 0;
        for (String keyword : keywords) {
            if (haystack.contains(keyword)) {
                matched++;
            }
        }
        return matched;
    }

    public boolean isStopWord(String token) {
        return lexicon.isStopWord(token);
    }

    static String stripParticle(String token) {
        for (String particle : TRAILING_PARTICLES) {
            if (token.length() > particle.length() + 1 && token.endsWith(particle)) {
                return token.substring(0, token.length() - particle.length());
            }
        }
        return token;
    }
}
