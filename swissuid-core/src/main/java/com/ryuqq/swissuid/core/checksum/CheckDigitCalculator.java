package com.ryuqq.swissuid.core.checksum;

import java.util.OptionalInt;

/**
 * UID 검증 숫자 계산기 (가중 모듈로 11).
 *
 * <p>eCH-0097 2.4.2절에 정의된 알고리즘을 구현합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * 1. 가중치 5, 4, 3, 2, 7, 6, 5, 4를 8자리 payload에 왼쪽부터 적용
 * 2. sum = Σ digit[i] * weight[i]
 * 3. result = 11 - (sum mod 11)
 * 4. result == 11 → 0
 *    result == 10 → 유효한 검증 숫자 없음 (빈 OptionalInt)
 *    그 외        → result
 * </pre>
 *
 * <p><strong>예시:</strong> payload {@code 1,0,9,3,2,2,5,5} → sum 109, 109 mod 11 = 10 → 검증 숫자 1</p>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public final class CheckDigitCalculator {

    /**
     * payload 자릿수.
     */
    public static final int PAYLOAD_LENGTH = 8;

    private static final int MODULUS = 11;
    private static final int[] WEIGHTS = {5, 4, 3, 2, 7, 6, 5, 4};

    private CheckDigitCalculator() {
    }

    /**
     * 8자리 payload의 검증 숫자 계산.
     *
     * @param payload 8자리 숫자 배열 (각 0~9)
     * @return 검증 숫자, 유효한 검증 숫자가 없는 payload인 경우 빈 값
     * @throws IllegalArgumentException payload가 null이거나 8자리가 아니거나 0~9 범위를 벗어난 경우
     */
    public static OptionalInt calculate(int[] payload) {
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (payload.length != PAYLOAD_LENGTH) {
            throw new IllegalArgumentException(
                "payload must have " + PAYLOAD_LENGTH + " digits (current: " + payload.length + ")"
            );
        }

        int sum = 0;
        for (int i = 0; i < PAYLOAD_LENGTH; i++) {
            int digit = payload[i];
            if (digit < 0 || digit > 9) {
                throw new IllegalArgumentException(
                    "payload digit at index " + i + " must be between 0 and 9 (current: " + digit + ")"
                );
            }
            sum += digit * WEIGHTS[i];
        }

        int result = MODULUS - (sum % MODULUS);
        if (result == MODULUS) {
            return OptionalInt.of(0);
        }
        if (result == 10) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(result);
    }

    /**
     * payload에 유효한 검증 숫자가 존재하는지 확인.
     *
     * @param payload 8자리 숫자 배열
     * @return 검증 숫자가 존재하면 true
     * @throws IllegalArgumentException payload가 유효하지 않은 경우
     */
    public static boolean hasCheckDigit(int[] payload) {
        return calculate(payload).isPresent();
    }
}
