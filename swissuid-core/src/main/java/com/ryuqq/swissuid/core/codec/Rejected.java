package com.ryuqq.swissuid.core.codec;

import com.ryuqq.swissuid.core.model.SwissUid;
import com.ryuqq.swissuid.core.model.UidError;
import com.ryuqq.swissuid.core.model.UidParseException;

/**
 * 검증 실패 결과.
 *
 * <p>실패는 입력 자체에 대한 최종 판정이므로 재시도 대상이 아닙니다.</p>
 *
 * @param error 실패 유형
 * @param message 오류 메시지
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public record Rejected(
    UidError error,
    String message
) implements ParseResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException error가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Rejected {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    @Override
    public SwissUid orElseThrow() {
        throw new UidParseException(error, message);
    }
}
