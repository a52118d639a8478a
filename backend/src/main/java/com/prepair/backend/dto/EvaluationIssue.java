package com.prepair.backend.dto;

/**
 * Issue labels reported with a score, shown to the user as-is.
 */
public final class EvaluationIssue {

    public static final String ANSWER_TOO_SHORT = "답변 길이 부족";
    public static final String MEANINGLESS_ANSWER = "의미 없는 답변";
    public static final String COPIED_QUESTION = "질문 복사";
    public static final String OFF_TOPIC = "질문과 무관한 답변";
    public static final String LENGTH_CAPPED = "답변 분량 부족으로 점수 상한 적용";
    public static final String LOW_KEYWORD_COVERAGE = "핵심 키워드 누락";
    public static final String LACKS_DETAIL = "구체적인 설명 부족";
    public static final String REPETITIVE_WORDING = "같은 단어 반복";
    public static final String TOO_FEW_WORDS = "단어 수 부족";
    public static final String INCOMPLETE_ANSWER = "질문 요구사항 미충족";
    public static final String FEEDBACK_FALLBACK = "상세 피드백 생성 실패";

    private EvaluationIssue() {
    }
}
