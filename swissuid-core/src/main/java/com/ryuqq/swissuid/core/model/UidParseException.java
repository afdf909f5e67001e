package com.ryuqq.swissuid.core.model;

/**
 * UID 검증 실패 예외.
 *
 * <p>{@link IllegalArgumentException}을 상속하므로 일반적인 인자 검증 실패와 동일하게 처리할 수 있으며,
 * {@link #error()}로 실패 유형을 구분할 수 있습니다.</p>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public final class UidParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final UidError error;

    /**
     * 생성자.
     *
     * @param error 실패 유형
     * @param message 오류 메시지
     * @throws IllegalArgumentException error가 null인 경우
     */
    public UidParseException(UidError error, String message) {
        super(message);
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        this.error = error;
    }

    /**
     * 실패 유형 조회.
     *
     * @return 실패 유형
     */
    public UidError error() {
        return error;
    }
}
