package com.ryuqq.swissuid.core.codec;

import com.ryuqq.swissuid.core.checksum.CheckDigitCalculator;
import com.ryuqq.swissuid.core.model.SwissUid;
import com.ryuqq.swissuid.core.model.UidError;
import com.ryuqq.swissuid.core.model.UidFormat;
import com.ryuqq.swissuid.core.model.UidParseException;
import com.ryuqq.swissuid.core.model.UidPrefix;
import org.junit.jupiter.api.Test;

import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * UidCodec 파싱/출력 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>그룹 형식, 연속 형식, HR/MWST 접미사 입력</li>
 *   <li>실패 유형별 거부 (접두사, 구조, 선행 0, 금지 payload, 검증 숫자 불일치)</li>
 *   <li>출력 → 재파싱 왕복</li>
 * </ul>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
class UidCodecTest {

    // ============================================================
    // 1. 유효한 입력
    // ============================================================

    @Test
    void parse_CanonicalForm_RendersAllFormats() {
        // When
        SwissUid uid = UidCodec.parse("CHE-109.322.551");

        // Then
        assertThat(uid.checkDigit()).isEqualTo(1);
        assertThat(uid.toStringPlain()).isEqualTo("CHE-109.322.551");
        assertThat(uid.toStringHr()).isEqualTo("CHE-109.322.551 HR");
        assertThat(uid.toStringMwst()).isEqualTo("CHE-109.322.551 MWST");
        assertThat(uid.toDebugString()).isEqualTo("CHE-109.322.55[1]");
    }

    @Test
    void parse_ContiguousDigits_EqualsGroupedForm() {
        // Given
        SwissUid grouped = UidCodec.parse("CHE-109.322.551");

        // When
        SwissUid withDash = UidCodec.parse("CHE-109322551");
        SwissUid withoutDash = UidCodec.parse("CHE109322551");

        // Then
        assertThat(withDash).isEqualTo(grouped);
        assertThat(withoutDash).isEqualTo(grouped);
        assertThat(withoutDash.toStringPlain()).isEqualTo("CHE-109.322.551");
    }

    @Test
    void parse_WithSuffix_IgnoresSuffix() {
        // Given
        SwissUid plain = UidCodec.parse("CHE-109.322.551");

        // When & Then
        assertThat(UidCodec.parse("CHE-109.322.551 HR")).isEqualTo(plain);
        assertThat(UidCodec.parse("CHE-109.322.551 MWST")).isEqualTo(plain);
        assertThat(UidCodec.parse("CHE109322551 MWST")).isEqualTo(plain);
    }

    @Test
    void parse_ZeroesInsidePayload_Accepted() {
        // When
        SwissUid uid = UidCodec.parse("CHE-100.002.005");

        // Then
        assertThat(uid.checkDigit()).isEqualTo(5);
        assertThat(uid.payloadDigits()).containsExactly(1, 0, 0, 0, 0, 2, 0, 0);
    }

    @Test
    void parse_CheckDigitZero_Accepted() {
        // When
        SwissUid uid = UidCodec.parse("CHE-100.001.000");

        // Then
        assertThat(uid.checkDigit()).isZero();
    }

    @Test
    void parse_AdmPrefix_KeepsPrefix() {
        // When
        SwissUid uid = SwissUid.parse("ADM-109.322.551");

        // Then
        assertThat(uid.prefix()).isEqualTo(UidPrefix.ADM);
        assertThat(uid.toStringPlain()).isEqualTo("ADM-109.322.551");
    }

    // ============================================================
    // 2. 거부되는 입력
    // ============================================================

    @Test
    void parse_IncompletePrefix_RejectsInvalidPrefix() {
        assertRejected("CH-109.322.551", UidError.INVALID_PREFIX);
    }

    @Test
    void parse_UnknownPrefix_RejectsInvalidPrefix() {
        assertRejected("ABC-109.322.551", UidError.INVALID_PREFIX);
        assertRejected("che-109.322.551", UidError.INVALID_PREFIX);
        assertRejected("109.322.551", UidError.INVALID_PREFIX);
    }

    @Test
    void parse_NullOrShortInput_RejectsInvalidPrefix() {
        assertRejected(null, UidError.INVALID_PREFIX);
        assertRejected("", UidError.INVALID_PREFIX);
        assertRejected("CH", UidError.INVALID_PREFIX);
    }

    @Test
    void parse_WrongGroupLength_RejectsMalformedDigits() {
        assertRejected("CHE-10.322.551", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322.5511", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-1093.22.551", UidError.MALFORMED_DIGITS);
    }

    @Test
    void parse_WrongSeparators_RejectsMalformedDigits() {
        assertRejected("CHE-109-322-551", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322551", UidError.MALFORMED_DIGITS);
        assertRejected("CHE 109.322.551", UidError.MALFORMED_DIGITS);
        assertRejected("CHE--109.322.551", UidError.MALFORMED_DIGITS);
    }

    @Test
    void parse_NonDigitCharacters_RejectsMalformedDigits() {
        assertRejected("CHE-1O9.322.551", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322.55X", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-", UidError.MALFORMED_DIGITS);
    }

    @Test
    void parse_UnknownOrMalformedSuffix_RejectsMalformedDigits() {
        assertRejected("CHE-109.322.551 TVA", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322.551 hr", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322.551 ", UidError.MALFORMED_DIGITS);
        assertRejected("CHE-109.322.551 HR MWST", UidError.MALFORMED_DIGITS);
        assertRejected(" CHE-109.322.551", UidError.INVALID_PREFIX);
    }

    @Test
    void parse_LeadingZero_RejectsLeadingZero() {
        assertRejected("CHE-009.322.551", UidError.LEADING_ZERO);
        assertRejected("CHE-010.322.557", UidError.LEADING_ZERO);
    }

    @Test
    void parse_WrongCheckDigit_RejectsMismatch() {
        // When & Then
        assertThatThrownBy(() -> UidCodec.parse("CHE-109.322.552"))
            .isInstanceOf(UidParseException.class)
            .hasMessage("'CHE-109.322.55[2]' should have the check digit [1]")
            .extracting(e -> ((UidParseException) e).error())
            .isEqualTo(UidError.CHECK_DIGIT_MISMATCH);
    }

    @Test
    void parse_SentinelPayload_RejectsEveryTrailingDigit() {
        // Given: payload 1,0,0,0,1,0,0,0 → 나머지 1 → 검증 숫자 없음
        for (int trailing = 0; trailing <= 9; trailing++) {
            // When & Then
            assertRejected("CHE-100.010.00" + trailing, UidError.NO_VALID_CHECK_DIGIT);
        }
    }

    // ============================================================
    // 3. 왕복 (출력 → 재파싱)
    // ============================================================

    @Test
    void parse_FormattedOutput_RoundTripsForSampledPayloads() {
        int valid = 0;
        int prohibited = 0;

        // Given: 10000000 ~ 99999999 구간을 소수 간격으로 샘플링
        for (long value = 10_000_000L; value <= 99_999_999L; value += 7_919L) {
            int[] payload = toDigits(value);
            OptionalInt checkDigit = CheckDigitCalculator.calculate(payload);

            if (checkDigit.isEmpty()) {
                // Then: 어떤 검증 숫자도 허용되지 않음
                prohibited++;
                String digits = Long.toString(value);
                for (int trailing = 0; trailing <= 9; trailing++) {
                    assertThat(UidCodec.tryParse("CHE" + digits + trailing))
                        .isEqualTo(new Rejected(UidError.NO_VALID_CHECK_DIGIT,
                            "'" + debugForm(digits, trailing) + "' is prohibited from use"));
                }
                continue;
            }

            // When
            SwissUid expected = SwissUid.of(UidPrefix.CHE, payload);
            SwissUid reparsed = UidCodec.parse(expected.toStringPlain());

            // Then
            valid++;
            assertThat(reparsed).isEqualTo(expected);
            assertThat(reparsed.checkDigit()).isEqualTo(checkDigit.getAsInt());
            assertThat(UidCodec.parse(expected.toStringHr())).isEqualTo(expected);
            assertThat(UidCodec.parse(expected.toStringMwst())).isEqualTo(expected);
            assertThat(expected.toStringPlain()).hasSize(15).matches("CHE-\\d{3}\\.\\d{3}\\.\\d{3}");
        }

        assertThat(valid).isPositive();
        assertThat(prohibited).isPositive();
    }

    // ============================================================
    // 4. 부가 API
    // ============================================================

    @Test
    void tryParse_ValidAndInvalid_ReturnsTypedResult() {
        // When
        ParseResult ok = UidCodec.tryParse("CHE-109.322.551");
        ParseResult rejected = UidCodec.tryParse("CHE-009.322.551");

        // Then
        assertThat(ok).isInstanceOf(Parsed.class);
        assertThat(ok.orElseThrow().toStringPlain()).isEqualTo("CHE-109.322.551");
        assertThat(rejected).isInstanceOf(Rejected.class);
        assertThat(((Rejected) rejected).error()).isEqualTo(UidError.LEADING_ZERO);
    }

    @Test
    void isValid_ReturnsBoolean() {
        assertThat(UidCodec.isValid("CHE-109.322.551")).isTrue();
        assertThat(UidCodec.isValid("CHE-109.322.552")).isFalse();
    }

    @Test
    void format_EachFormat_MatchesInstanceMethods() {
        // Given
        SwissUid uid = UidCodec.parse("CHE-109.322.551");

        // When & Then
        assertThat(UidCodec.format(uid, UidFormat.PLAIN)).isEqualTo(uid.toStringPlain());
        assertThat(UidCodec.format(uid, UidFormat.HR)).isEqualTo(uid.toStringHr());
        assertThat(UidCodec.format(uid, UidFormat.MWST)).isEqualTo(uid.toStringMwst());
        assertThatThrownBy(() -> UidCodec.format(null, UidFormat.PLAIN))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null");
    }

    private static void assertRejected(String input, UidError expected) {
        assertThatThrownBy(() -> UidCodec.parse(input))
            .isInstanceOf(UidParseException.class)
            .extracting(e -> ((UidParseException) e).error())
            .isEqualTo(expected);

        assertThat(UidCodec.tryParse(input))
            .isInstanceOfSatisfying(Rejected.class, r -> assertThat(r.error()).isEqualTo(expected));
    }

    private static int[] toDigits(long value) {
        String text = Long.toString(value);
        int[] digits = new int[text.length()];
        for (int i = 0; i < digits.length; i++) {
            digits[i] = text.charAt(i) - '0';
        }
        return digits;
    }

    private static String debugForm(String digits, int trailing) {
        return "CHE-" + digits.substring(0, 3) + "." + digits.substring(3, 6) + "."
            + digits.substring(6, 8) + "[" + trailing + "]";
    }
}
