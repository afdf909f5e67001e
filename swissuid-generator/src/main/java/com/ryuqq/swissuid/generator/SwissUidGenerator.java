package com.ryuqq.swissuid.generator;

import com.ryuqq.swissuid.core.checksum.CheckDigitCalculator;
import com.ryuqq.swissuid.core.model.SwissUid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.random.RandomGenerator;

/**
 * 유효한 UID 무작위 생성기.
 *
 * <p>테스트 데이터나 샘플 데이터 생성에 사용합니다. 생성된 UID는 형식과 검증 숫자만 유효하며,
 * 실제 등록된 기업 번호라는 보장은 없습니다.</p>
 *
 * <p><strong>생성 흐름:</strong></p>
 * <pre>
 * 1. 첫 번째 숫자: 1~9 (선행 0 금지)
 * 2. 나머지 7자리: 0~9
 * 3. 검증 숫자 계산
 *    - 계산 불가(나머지 10)인 경우 첫 번째 숫자를 조정
 *      (1 이하 → +1, 그 외 → -1) 후 재계산
 *    - 첫 번째 숫자의 가중치는 5이므로 ±1 조정 시 가중합이 ±5 변하여 항상 유효해짐
 * 4. SwissUid 생성 (검증 경로 동일)
 * </pre>
 *
 * <p><strong>Thread-safety:</strong> 주입된 RandomGenerator의 thread-safety를 따릅니다.</p>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public final class SwissUidGenerator {

    private static final Logger log = LoggerFactory.getLogger(SwissUidGenerator.class);

    private final RandomGenerator random;
    private final GeneratorConfig config;

    /**
     * 기본 설정 생성자.
     *
     * <p>{@link RandomGenerator#getDefault()}와 기본 {@link GeneratorConfig}를 사용합니다.</p>
     */
    public SwissUidGenerator() {
        this(RandomGenerator.getDefault(), new GeneratorConfig());
    }

    /**
     * 생성자.
     *
     * @param random 난수 생성기
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public SwissUidGenerator(RandomGenerator random, GeneratorConfig config) {
        if (random == null) {
            throw new IllegalArgumentException("random cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.random = random;
        this.config = config;
    }

    /**
     * 유효한 UID 하나 생성.
     *
     * @return 검증된 SwissUid
     */
    public SwissUid next() {
        int[] payload = new int[CheckDigitCalculator.PAYLOAD_LENGTH];
        payload[0] = random.nextInt(1, 10);
        for (int i = 1; i < payload.length; i++) {
            payload[i] = random.nextInt(0, 10);
        }

        if (!CheckDigitCalculator.hasCheckDigit(payload)) {
            int original = payload[0];
            payload[0] = original <= 1 ? original + 1 : original - 1;
            log.debug("Payload has no valid check digit, adjusted first digit {} → {}", original, payload[0]);
        }

        return SwissUid.of(config.prefix(), payload);
    }

    /**
     * 유효한 UID 여러 개 생성.
     *
     * @param count 생성 개수 (1 ~ maxBatchSize)
     * @return 생성된 SwissUid 목록 (중복 가능)
     * @throws IllegalArgumentException count가 범위를 벗어난 경우
     */
    public List<SwissUid> next(int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive (current: " + count + ")");
        }
        if (count > config.maxBatchSize()) {
            throw new IllegalArgumentException(
                "count cannot exceed maxBatchSize " + config.maxBatchSize() + " (current: " + count + ")"
            );
        }

        List<SwissUid> uids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            uids.add(next());
        }
        log.info("Generated {} {} UIDs", count, config.prefix());
        return uids;
    }
}
