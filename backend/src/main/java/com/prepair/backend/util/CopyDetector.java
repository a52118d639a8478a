package com.prepair.backend.util;

import com.prepair.backend.dto.CopyDetectionVerdict;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects answers that copy or paraphrase the question instead of answering it.
 *
 * Checks run cheapest and most specific first and the first hit wins:
 * exact match, verbatim inclusion, longest common substring, 4-gram overlap,
 * edit distance, word overlap.
 */
@Component
@Slf4j
public class CopyDetector {

    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\uAC00-\\uD7A3]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final int NGRAM_SIZE = 4;

    private final LexicalAnalyzer lexicalAnalyzer;
    private final Policy policy;

    @Autowired
    public CopyDetector(LexicalAnalyzer lexicalAnalyzer) {
        this(lexicalAnalyzer, Policy.builder().build());
    }

    public CopyDetector(LexicalAnalyzer lexicalAnalyzer, Policy policy) {
        this.lexicalAnalyzer = lexicalAnalyzer;
        this.policy = policy;
    }

    public CopyDetectionVerdict detect(String question, String answer) {
        String q = normalize(question);
        String a = normalize(answer);
        if (q.isEmpty() || a.isEmpty()) {
            return CopyDetectionVerdict.original();
        }

        // 1. exact
        if (q.equals(a)) {
            return CopyDetectionVerdict.copied("Answer is identical to the question", 1.0);
        }

        // 2. question included almost verbatim
        if (a.contains(q) && a.length() < q.length() * policy.getInclusionLengthFactor()) {
            return CopyDetectionVerdict.copied("Answer repeats the whole question",
                    (double) q.length() / a.length());
        }

        // 3. longest common substring
        int lcs = longestCommonSubstring(q, a);
        double lcsRatio = (double) lcs / q.length();
        if (lcsRatio > policy.getLcsRatioThreshold() && lcs >= policy.getLcsMinLength()) {
            return CopyDetectionVerdict.copied("Answer contains a long passage of the question", lcsRatio);
        }

        // 4. character n-gram overlap
        double ngramOverlap = ngramOverlap(q, a, NGRAM_SIZE);
        if (ngramOverlap > policy.getNgramOverlapThreshold()) {
            return CopyDetectionVerdict.copied("Answer shares most character sequences with the question", ngramOverlap);
        }

        // 5. edit distance, skipped when the table would exceed the cell budget
        int maxLength = Math.max(q.length(), a.length());
        double editSimilarity = (long) q.length() * a.length() > policy.getMaxEditCells()
                ? 0.0
                : 1.0 - (double) levenshtein(q, a) / maxLength;
        if (editSimilarity > policy.getEditSimilarityThreshold()) {
            return CopyDetectionVerdict.copied("Answer is a light edit of the question", editSimilarity);
        }

        // 6. word overlap
        double wordOverlap = wordOverlap(question, answer);
        if (wordOverlap > policy.getWordOverlapThreshold()
                && a.length() < q.length() * policy.getWordOverlapLengthFactor()) {
            return CopyDetectionVerdict.copied("Answer mostly reuses the question's words", wordOverlap);
        }

        log.debug("No copy detected (lcs={}, ngram={}, edit={}, words={})",
                lcs, ngramOverlap, editSimilarity, wordOverlap);
        return CopyDetectionVerdict.original();
    }

    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return NON_WORD.matcher(text.toLowerCase(Locale.ROOT)).replaceAll("");
    }

    /**
     * Length of the longest contiguous common substring, keeping only two
     * DP rows.
     */
    static int longestCommonSubstring(String s, String t) {
        int[] previous = new int[t.length() + 1];
        int[] current = new int[t.length() + 1];
        int best = 0;
        for (int i = 1; i <= s.length(); i++) {
            for (int j = 1; j <= t.length(); j++) {
                if (s.charAt(i - 1) == t.charAt(j - 1)) {
                    current[j] = previous[j - 1] + 1;
                    if (current[j] > best) {
                        best = current[j];
                    }
                } else {
                    current[j] = 0;
                }
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return best;
    }

    /**
     * Fraction of the source's distinct n-grams that also occur in the target.
     */
    static double ngramOverlap(String source, String target, int n) {
        Set<String> sourceGrams = ngrams(source, n);
        if (sourceGrams.isEmpty()) {
            return 0.0;
        }
        Set<String> targetGrams = ngrams(target, n);
        int shared = 0;
        for (String gram : sourceGrams) {
            if (targetGrams.contains(gram)) {
                shared++;
            }
        }
        return (double) shared / sourceGrams.size();
    }

    private static Set<String> ngrams(String text, int n) {
        Set<String> grams = new HashSet<>();
        for (int i = 0; i + n <= text.length(); i++) {
            grams.add(text.substring(i, i + n));
        }
        return grams;
    }

    /**
     * Levenshtein distance over two rolling rows. When the lengths differ by
     * more than half of the longer string the strings cannot be
     * near-duplicates, so the longer length is returned without filling the
     * table.
     */
    static int levenshtein(String s, String t) {
        int m = s.length();
        int n = t.length();
        int longer = Math.max(m, n);
        if (Math.abs(m - n) > longer * 0.5) {
            return longer;
        }

        int[] previous = new int[n + 1];
        int[] current = new int[n + 1];
        for (int j = 0; j <= n; j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= m; i++) {
            current[0] = i;
            for (int j = 1; j <= n; j++) {
                int cost = s.charAt(i - 1) == t.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(previous[j] + 1, current[j - 1] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[n];
    }

    private double wordOverlap(String question, String answer) {
        Set<String> questionWords = new HashSet<>(lexicalAnalyzer.tokenize(question));
        List<String> answerWords = lexicalAnalyzer.tokenize(answer).stream()
                .filter(word -> word.length() >= 2 && !lexicalAnalyzer.isStopWord(word))
                .collect(Collectors.toList());
        if (answerWords.isEmpty()) {
            return 0.0;
        }
        long shared = answerWords.stream().filter(questionWords::contains).count();
        return (double) shared / answerWords.size();
    }

    @Getter
    @Builder
    public static class Policy {
        @Builder.Default
        private final double inclusionLengthFactor = 1.3;
        @Builder.Default
        private final double lcsRatioThreshold = 0.4;
        @Builder.Default
        private final int lcsMinLength = 15;
        @Builder.Default
        private final double ngramOverlapThreshold = 0.5;
        @Builder.Default
        private final double editSimilarityThreshold = 0.85;
        @Builder.Default
        private final long maxEditCells = 5_000_000L;
        @Builder.Default
        private final double wordOverlapThreshold = 0.7;
        @Builder.Default
        private final double wordOverlapLengthFactor = 1.8;
    }
}
