package com.ryuqq.swissuid.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Nibbles 패킹 테스트.
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
class NibblesTest {

    @Test
    void pack_Digits_ProducesBcdInt() {
        // Given
        int[] digits = {1, 0, 9, 3, 2, 2, 5, 5};

        // When
        int packed = Nibbles.pack(digits);

        // Then
        assertEquals(0x10932255, packed);
    }

    @Test
    void unpack_HighNibbleSet_ReturnsDigitsWithoutSignExtension() {
        // Given: 0x99999999는 int 범위에서 음수
        int packed = 0x99999999;

        // When
        int[] digits = Nibbles.unpack(packed);

        // Then
        assertArrayEquals(new int[] {9, 9, 9, 9, 9, 9, 9, 9}, digits);
    }

    @Test
    void digitAt_EachIndex_ReturnsDigit() {
        // Given
        int packed = 0x12345678;

        // When & Then
        for (int i = 0; i < 8; i++) {
            assertEquals(i + 1, Nibbles.digitAt(packed, i));
        }
    }
}
