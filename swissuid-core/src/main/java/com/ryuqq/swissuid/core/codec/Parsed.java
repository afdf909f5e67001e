package com.ryuqq.swissuid.core.codec;

import com.ryuqq.swissuid.core.model.SwissUid;

/**
 * 검증 성공 결과.
 *
 * @param uid 검증된 SwissUid
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public record Parsed(SwissUid uid) implements ParseResult {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException uid가 null인 경우
     */
    public Parsed {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
    }

    @Override
    public SwissUid orElseThrow() {
        return uid;
    }
}
