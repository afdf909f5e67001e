package com.ryuqq.swissuid.core.codec;

import com.ryuqq.swissuid.core.model.SwissUid;
import com.ryuqq.swissuid.core.model.UidParseException;

/**
 * UID 파싱 결과.
 *
 * <p>ParseResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Parsed}: 검증 성공</li>
 *   <li>{@link Rejected}: 검증 실패 (원인은 {@link Rejected#error()})</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 두 케이스 외의 구현을 허용하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ParseResult result = UidCodec.tryParse(input);
 * if (result instanceof Parsed parsed) {
 *     save(parsed.uid());
 * } else if (result instanceof Rejected rejected) {
 *     report(rejected.error(), rejected.message());
 * }
 * </pre>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public sealed interface ParseResult permits Parsed, Rejected {

    /**
     * 검증 성공 여부.
     *
     * @return 성공이면 true
     */
    default boolean isParsed() {
        return this instanceof Parsed;
    }

    /**
     * 검증 실패 여부.
     *
     * @return 실패면 true
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 성공 시 SwissUid 반환, 실패 시 예외.
     *
     * @return 검증된 SwissUid
     * @throws UidParseException 실패 결과인 경우
     */
    SwissUid orElseThrow();
}
