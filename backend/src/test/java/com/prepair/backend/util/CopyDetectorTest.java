package com.prepair.backend.util;

import com.prepair.backend.config.LexiconConfig;
import com.prepair.backend.dto.CopyDetectionVerdict;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CopyDetectorTest {

    private static final String QUESTION = "객체지향 프로그래밍의 특징은 무엇인가요?";

    private CopyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new CopyDetector(new LexicalAnalyzer(new LexiconConfig().lexicon()));
    }

    @Test
    void shouldFlagAnswerIdenticalAfterNormalization() {
        CopyDetectionVerdict verdict = detector.detect(QUESTION, "  객체지향   프로그래밍의 특징은, 무엇인가요 ");

        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getCopyRatio()).isEqualTo(1.0);
    }

    @Test
    void shouldFlagQuestionRepeatedWithTinyAddition() {
        CopyDetectionVerdict verdict = detector.detect(QUESTION, QUESTION + " 입니다");

        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getReason()).contains("whole question");
    }

    @Test
    void shouldFlagLongCopiedPassage() {
        String question = "운영체제에서 프로세스와 스레드의 차이점을 설명하세요";
        String answer = "운영체제에서 프로세스와 스레드의 차이점은 메모리 공유 여부라고 생각합니다 정말로 그렇습니다";

        CopyDetectionVerdict verdict = detector.detect(question, answer);

        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getReason()).contains("long passage");
        assertThat(verdict.getCopyRatio()).isBetween(0.0, 1.0);
    }

    @Test
    void shouldFlagReorderedChunksByCharacterOverlap() {
        // GIVEN no shared passage reaches 15 characters
        String question = "Compare heap memory and stack frames in Java";
        String answer = "stack frames, then heap memory, compare in Java";

        // WHEN
        CopyDetectionVerdict verdict = detector.detect(question, answer);

        // THEN
        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getReason()).isEqualTo("Answer shares most character sequences with the question");
        assertThat(verdict.getCopyRatio()).isGreaterThan(0.5);
    }

    @Test
    void shouldFlagShortQuestionWithOneCharacterChanged() {
        CopyDetectionVerdict verdict = detector.detect("What is a JVM?", "What is b JVM?");

        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getReason()).isEqualTo("Answer is a light edit of the question");
        assertThat(verdict.getCopyRatio()).isCloseTo(0.9, within(1e-9));
    }

    @Test
    void shouldFlagAnswerThatOnlyShufflesQuestionWords() {
        CopyDetectionVerdict verdict = detector.detect("Why use TCP or UDP for web games",
                "web games use UDP or TCP why");

        assertThat(verdict.isCopied()).isTrue();
        assertThat(verdict.getReason()).isEqualTo("Answer mostly reuses the question's words");
        assertThat(verdict.getCopyRatio()).isEqualTo(1.0);
    }

    @Test
    void shouldNotFlagWordReuseWhenAnswerIsMuchLongerThanQuestion() {
        // GIVEN every answer word comes from the question, but the answer is over 1.8x as long
        String question = "Why use TCP or UDP for web games";
        String answer = "web games use UDP or TCP why web games use UDP or TCP why games web";
        assertThat(CopyDetector.normalize(answer).length())
                .isGreaterThanOrEqualTo((int) Math.ceil(CopyDetector.normalize(question).length() * 1.8));

        // WHEN
        CopyDetectionVerdict verdict = detector.detect(question, answer);

        // THEN
        assertThat(verdict.isCopied()).isFalse();
    }

    @Test
    void shouldHandleVeryLongUnrelatedTextWithinBoundedMemory() {
        // GIVEN two 20k-character texts, far past the edit-distance cell budget
        Random random = new Random(42);
        String question = randomLetters(random, 20_000);
        String answer = randomLetters(random, 20_000);

        // WHEN
        CopyDetectionVerdict verdict = detector.detect(question, answer);

        // THEN
        assertThat(verdict.isCopied()).isFalse();
    }

    @Test
    void shouldSkipEditDistanceBeyondCellBudget() {
        CopyDetector.Policy tinyBudget = CopyDetector.Policy.builder()
                .maxEditCells(10)
                .build();
        CopyDetector budgetDetector = new CopyDetector(new LexicalAnalyzer(new LexiconConfig().lexicon()), tinyBudget);

        assertThat(detector.detect("What is a JVM?", "What is b JVM?").getReason())
                .isEqualTo("Answer is a light edit of the question");
        assertThat(budgetDetector.detect("What is a JVM?", "What is b JVM?").getReason())
                .isEqualTo("Answer mostly reuses the question's words");
    }

    @Test
    void shouldNotFlagAnswerSharingNoVocabulary() {
        CopyDetectionVerdict verdict = detector.detect(QUESTION, "데이터베이스 인덱스는 조회 속도를 높이기 위한 자료구조입니다");

        assertThat(verdict.isCopied()).isFalse();
        assertThat(verdict.getCopyRatio()).isNull();
    }

    @Test
    void shouldNotFlagGenuineAnswerThatReusesKeywords() {
        CopyDetectionVerdict verdict = detector.detect(QUESTION,
                "객체지향의 대표적인 특징은 캡슐화, 상속, 다형성, 추상화입니다. 예를 들어 캡슐화는 내부 상태를 숨기고 메서드로만 접근하게 합니다.");

        assertThat(verdict.isCopied()).isFalse();
    }

    @Test
    void shouldTreatEmptyTextAsOriginal() {
        assertThat(detector.detect(QUESTION, "?!").isCopied()).isFalse();
        assertThat(detector.detect("", "아무 답변").isCopied()).isFalse();
    }

    @Test
    void shouldRespectCustomPolicy() {
        CopyDetector.Policy permissive = CopyDetector.Policy.builder()
                .inclusionLengthFactor(1.0)
                .lcsRatioThreshold(1.1)
                .ngramOverlapThreshold(1.1)
                .editSimilarityThreshold(1.1)
                .wordOverlapThreshold(1.1)
                .build();
        CopyDetector permissiveDetector = new CopyDetector(new LexicalAnalyzer(new LexiconConfig().lexicon()), permissive);

        assertThat(detector.detect(QUESTION, QUESTION + " 입니다").isCopied()).isTrue();
        assertThat(permissiveDetector.detect(QUESTION, QUESTION + " 입니다").isCopied()).isFalse();
    }

    @Test
    void shouldComputeLongestCommonSubstring() {
        assertThat(CopyDetector.longestCommonSubstring("abcdef", "zcdez")).isEqualTo(3);
        assertThat(CopyDetector.longestCommonSubstring("abc", "xyz")).isZero();
    }

    @Test
    void shouldComputeLevenshteinDistance() {
        assertThat(CopyDetector.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(CopyDetector.levenshtein("same", "same")).isZero();
    }

    @Test
    void shouldComputeLevenshteinForUnevenLengths() {
        assertThat(CopyDetector.levenshtein("flaw", "lawn")).isEqualTo(2);
        assertThat(CopyDetector.levenshtein("abcdef", "abcd")).isEqualTo(2);
    }

    @Test
    void shouldShortCircuitLevenshteinOnVeryDifferentLengths() {
        assertThat(CopyDetector.levenshtein("ab", "abcdefgh")).isEqualTo(8);
    }

    @Test
    void shouldComputeNgramOverlapAgainstSourceGrams() {
        assertThat(CopyDetector.ngramOverlap("abcdef", "xxabcdxx", 4)).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(CopyDetector.ngramOverlap("abc", "abc", 4)).isZero();
    }

    @Test
    void shouldNormalizeByStrippingPunctuationAndWhitespace() {
        assertThat(CopyDetector.normalize("Hello, World! 안녕?")).isEqualTo("helloworld안녕");
    }

    private static String randomLetters(Random random, int length) {
        StringBuilder text = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            text.append((char) ('a' + random.nextInt(26)));
        }
        return text.toString();
    }
}
