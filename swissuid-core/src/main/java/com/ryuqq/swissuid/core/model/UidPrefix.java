package com.ryuqq.swissuid.core.model;

/**
 * UID 접두사.
 *
 * <p>eCH-0097은 기업용 {@code CHE}와 행정 단위용 {@code ADM} 두 가지 접두사를 정의합니다.
 * 두 접두사 모두 동일한 9자리 숫자 체계와 검증 숫자 알고리즘을 사용합니다.</p>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public enum UidPrefix {

    /**
     * 기업 (Unternehmen).
     */
    CHE,

    /**
     * 행정 단위 (Administration).
     */
    ADM;

    /**
     * 접두사 문자 수.
     */
    public static final int LENGTH = 3;

    /**
     * 문자열에서 접두사 조회 (대소문자 구분).
     *
     * @param value 접두사 문자열
     * @return UidPrefix
     * @throws UidParseException 알 수 없는 접두사인 경우
     */
    public static UidPrefix of(String value) {
        for (UidPrefix prefix : values()) {
            if (prefix.name().equals(value)) {
                return prefix;
            }
        }
        throw new UidParseException(
            UidError.INVALID_PREFIX,
            "Prefix must be 'CHE' or 'ADM' (current: '" + value + "')"
        );
    }
}
