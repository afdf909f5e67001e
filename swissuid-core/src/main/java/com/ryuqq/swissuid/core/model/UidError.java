package com.ryuqq.swissuid.core.model;

/**
 * UID 검증 실패 유형.
 *
 * <p>파싱 파이프라인은 첫 번째 실패에서 즉시 중단되며, 실패 원인은 항상 아래 중 하나입니다.</p>
 *
 * <p><strong>검사 순서:</strong></p>
 * <pre>
 * INVALID_PREFIX
 *    │
 *    ▼
 * MALFORMED_DIGITS
 *    │
 *    ▼
 * LEADING_ZERO
 *    │
 *    ▼
 * NO_VALID_CHECK_DIGIT
 *    │
 *    ▼
 * CHECK_DIGIT_MISMATCH
 * </pre>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public enum UidError {

    /**
     * 접두사 누락 또는 알 수 없는 접두사 (CHE, ADM 외).
     */
    INVALID_PREFIX,

    /**
     * 자릿수, 문자 종류 또는 구분자 위치 오류.
     */
    MALFORMED_DIGITS,

    /**
     * 첫 번째 payload 숫자가 0.
     */
    LEADING_ZERO,

    /**
     * payload의 가중합 나머지가 금지된 값이라 어떤 검증 숫자도 유효하지 않음.
     */
    NO_VALID_CHECK_DIGIT,

    /**
     * 입력된 검증 숫자가 계산된 검증 숫자와 다름.
     */
    CHECK_DIGIT_MISMATCH;

    /**
     * 입력 구조(형식) 오류인지 확인.
     *
     * <p>구조 오류가 아닌 경우는 숫자 자체의 의미 오류(선행 0, 체크섬)입니다.</p>
     *
     * @return INVALID_PREFIX 또는 MALFORMED_DIGITS인 경우 true
     */
    public boolean isStructural() {
        return this == INVALID_PREFIX || this == MALFORMED_DIGITS;
    }
}
