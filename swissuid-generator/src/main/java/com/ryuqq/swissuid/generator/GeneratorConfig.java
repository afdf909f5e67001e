package com.ryuqq.swissuid.generator;

import com.ryuqq.swissuid.core.model.UidPrefix;

/**
 * SwissUidGenerator 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>prefix: 생성할 UID의 접두사 (기본 CHE)</li>
 *   <li>maxBatchSize: {@code next(int)} 한 번에 생성 가능한 최대 개수 (기본 10000)</li>
 * </ul>
 *
 * @author SwissUid Team
 * @since 1.0.0
 * @param prefix 접두사 (null 불가)
 * @param maxBatchSize 최대 배치 크기 (1 이상이어야 함)
 */
public record GeneratorConfig(UidPrefix prefix, int maxBatchSize) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: prefix=CHE, maxBatchSize=10000</p>
     */
    public GeneratorConfig() {
        this(UidPrefix.CHE, 10000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public GeneratorConfig {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException(
                "maxBatchSize must be positive (current: " + maxBatchSize + ")"
            );
        }
    }

    /**
     * prefix만 변경한 새 인스턴스 생성.
     *
     * @param prefix 새로운 접두사
     * @return 새 GeneratorConfig 인스턴스
     */
    public GeneratorConfig withPrefix(UidPrefix prefix) {
        return new GeneratorConfig(prefix, this.maxBatchSize);
    }

    /**
     * maxBatchSize만 변경한 새 인스턴스 생성.
     *
     * @param maxBatchSize 새로운 최대 배치 크기
     * @return 새 GeneratorConfig 인스턴스
     */
    public GeneratorConfig withMaxBatchSize(int maxBatchSize) {
        return new GeneratorConfig(this.prefix, maxBatchSize);
    }
}
