package com.ryuqq.swissuid.core.model;

/**
 * 십진 숫자 배열과 nibble(4비트) 패킹 정수 간 변환.
 *
 * <p>8자리 숫자를 하나의 {@code int}에 왼쪽(MSB)부터 채웁니다.
 * 예: {@code 1,0,9,3,2,2,5,5 → 0x10932255}</p>
 */
final class Nibbles {

    static final int DIGITS_PER_INT = 8;

    private Nibbles() {
    }

    static int pack(int[] digits) {
        int packed = 0;
        for (int i = 0; i < DIGITS_PER_INT; i++) {
            packed = (packed << 4) | (digits[i] & 0x0F);
        }
        return packed;
    }

    static int[] unpack(int packed) {
        int[] digits = new int[DIGITS_PER_INT];
        for (int i = 0; i < DIGITS_PER_INT; i++) {
            digits[i] = (packed >>> ((DIGITS_PER_INT - 1 - i) * 4)) & 0x0F;
        }
        return digits;
    }

    static int digitAt(int packed, int index) {
        return (packed >>> ((DIGITS_PER_INT - 1 - index) * 4)) & 0x0F;
    }
}
