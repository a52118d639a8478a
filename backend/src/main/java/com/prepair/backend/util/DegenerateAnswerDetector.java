package com.prepair.backend.util;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 🛡️ Degenerate Answer Detector
 *
 * Flags answers that carry no meaning and must score 0 without further checks:
 * - one character dominating the text
 * - a short unit repeated over and over ("abcdabcd...")
 * - long text with almost no real words
 * - keyboard mashing
 */
@Component
@Slf4j
public class DegenerateAnswerDetector {

    private static final double DOMINANT_CHAR_RATIO = 0.8;
    private static final int MIN_REPEATS = 5;
    private static final double REPEAT_COVERAGE = 0.7;
    private static final int MIN_MEANINGFUL_TOKENS = 2;
    private static final int MEANINGFUL_CHECK_MIN_LENGTH = 20;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern MEANINGFUL_TOKEN = Pattern.compile("[\\p{L}]{2,}");

    // 🚫 Keyboard mashing: adjacent-key runs, bare jamo, one key held down, a digit repeated 3+ times
    private static final Pattern[] MASHING_PATTERNS = {
            Pattern.compile("(?i)(asdf|sdfg|dfgh|fghj|ghjk|hjkl|jkl;)"),
            Pattern.compile("(?i)(qwer|wert|rtyu|tyui|yuio|uiop)"),
            Pattern.compile("(?i)(zxcv|xcvb|cvbn|vbnm)"),
            Pattern.compile("[ㄱ-ㅎㅏ-ㅣ]{4,}"),
            Pattern.compile("(?i)([a-z])\\1{3,}"),
            Pattern.compile("(\\d)\\1{2,}")
    };

    /**
     * @return true when the answer should be treated as meaningless
     */
    public boolean isMeaningless(String answer) {
        if (answer == null) {
            return true;
        }
        String text = answer.trim();
        if (text.isEmpty()) {
            return true;
        }
        String compact = WHITESPACE.matcher(text).replaceAll("");

        if (hasDominantCharacter(compact)) {
            log.debug("Degenerate answer: dominant character");
            return true;
        }
        if (hasRepeatedUnit(compact)) {
            log.debug("Degenerate answer: repeated unit");
            return true;
        }
        if (text.length() > MEANINGFUL_CHECK_MIN_LENGTH && countMeaningfulTokens(text) < MIN_MEANINGFUL_TOKENS) {
            log.debug("Degenerate answer: too few meaningful words");
            return true;
        }
        for (Pattern pattern : MASHING_PATTERNS) {
            if (pattern.matcher(text).find()) {
                log.debug("Degenerate answer: keyboard mashing ({})", pattern.pattern());
                return true;
            }
        }
        return false;
    }

    static boolean hasDominantCharacter(String compact) {
        if (compact.isEmpty()) {
            return false;
        }
        Map<Integer, Integer> counts = new HashMap<>();
        int max = 0;
        for (int i = 0; i < compact.length(); i++) {
            int count = counts.merge((int) compact.charAt(i), 1, Integer::sum);
            max = Math.max(max, count);
        }
        return max > compact.length() * DOMINANT_CHAR_RATIO;
    }

    /**
     * A 2-4 character prefix repeated back to back at least five times and
     * covering most of the text.
     */
    static boolean hasRepeatedUnit(String compact) {
        for (int unitLength = 2; unitLength <= 4; unitLength++) {
            if (compact.length() < unitLength * MIN_REPEATS) {
                break;
            }
            String unit = compact.substring(0, unitLength);
            int repeats = 0;
            int index = 0;
            while (compact.startsWith(unit, index)) {
                repeats++;
                index += unitLength;
            }
            if (repeats >= MIN_REPEATS && (double) (repeats * unitLength) / compact.length() > REPEAT_COVERAGE) {
                return true;
            }
        }
        return false;
    }

    private static int countMeaningfulTokens(String text) {
        Matcher matcher = MEANINGFUL_TOKEN.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
