package com.ryuqq.swissuid.core.model;

/**
 * UID 출력 형식.
 *
 * <ul>
 *   <li>{@link #PLAIN}: {@code CHE-109.322.551}</li>
 *   <li>{@link #HR}: {@code CHE-109.322.551 HR} (상업등기부, Handelsregister)</li>
 *   <li>{@link #MWST}: {@code CHE-109.322.551 MWST} (부가가치세, Mehrwertsteuer)</li>
 * </ul>
 *
 * <p>파싱 시 HR/MWST 접미사는 허용되지만 검증 결과에는 영향을 주지 않습니다.</p>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public enum UidFormat {

    PLAIN(null),

    HR("HR"),

    MWST("MWST");

    private final String suffix;

    UidFormat(String suffix) {
        this.suffix = suffix;
    }

    /**
     * 접미사 토큰 조회.
     *
     * @return 접미사 (PLAIN은 null)
     */
    public String suffix() {
        return suffix;
    }

    /**
     * 접미사 토큰으로 형식 조회 (대소문자 구분).
     *
     * @param token 접미사 토큰
     * @return 해당 형식, 알 수 없는 토큰이면 null
     */
    public static UidFormat fromSuffix(String token) {
        for (UidFormat format : values()) {
            if (format.suffix != null && format.suffix.equals(token)) {
                return format;
            }
        }
        return null;
    }
}
