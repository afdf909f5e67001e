package com.ryuqq.swissuid.core.model;

import com.ryuqq.swissuid.core.checksum.CheckDigitCalculator;
import com.ryuqq.swissuid.core.codec.UidCodec;

import java.util.OptionalInt;

/**
 * 스위스 기업 식별번호 (UID, Unternehmens-Identifikationsnummer).
 *
 * <p>UID는 접두사와 9자리 숫자로 구성되며, 가장 오른쪽 숫자가 검증 숫자입니다.
 * 형식: {@code CHE-XXX.XXX.XXXC}</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>저장 형식:</strong> 8자리 payload는 nibble 단위로 하나의 {@code int}에, 검증 숫자는 {@code byte}에 저장</p>
 * <p><strong>유효성 검증 (모든 인스턴스에서 성립):</strong></p>
 * <ul>
 *   <li>payload 8자리, 각 0~9</li>
 *   <li>첫 번째 payload 숫자는 0이 아님</li>
 *   <li>검증 숫자 = {@link CheckDigitCalculator#calculate(int[])}의 결과</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * SwissUid uid = SwissUid.parse("CHE-109.322.551");
 * uid.checkDigit();      // 1
 * uid.toStringHr();      // "CHE-109.322.551 HR"
 * uid.toStringMwst();    // "CHE-109.322.551 MWST"
 * uid.toDebugString();   // "CHE-109.322.55[1]"
 * </pre>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public final class SwissUid implements Comparable<SwissUid> {

    private final UidPrefix prefix;
    private final int payload;
    private final byte checkDigit;

    private SwissUid(UidPrefix prefix, int payload, byte checkDigit) {
        this.prefix = prefix;
        this.payload = payload;
        this.checkDigit = checkDigit;
    }

    /**
     * 문자열에서 SwissUid 생성.
     *
     * @param text UID 문자열 (예: {@code CHE-109.322.551}, {@code CHE109322551 MWST})
     * @return SwissUid 인스턴스
     * @throws UidParseException 유효하지 않은 UID인 경우
     * @see UidCodec#parse(String)
     */
    public static SwissUid parse(String text) {
        return UidCodec.parse(text);
    }

    /**
     * payload로부터 검증 숫자를 계산하여 SwissUid 생성.
     *
     * @param prefix 접두사
     * @param payload 8자리 숫자 배열
     * @return SwissUid 인스턴스
     * @throws IllegalArgumentException prefix가 null인 경우
     * @throws UidParseException payload가 유효하지 않은 경우
     */
    public static SwissUid of(UidPrefix prefix, int[] payload) {
        int computed = requireCheckDigit(prefix, payload, -1);
        return new SwissUid(prefix, Nibbles.pack(payload), (byte) computed);
    }

    /**
     * payload와 검증 숫자로 SwissUid 생성.
     *
     * @param prefix 접두사
     * @param payload 8자리 숫자 배열
     * @param checkDigit 검증 숫자
     * @return SwissUid 인스턴스
     * @throws IllegalArgumentException prefix가 null인 경우
     * @throws UidParseException payload가 유효하지 않거나 검증 숫자가 일치하지 않는 경우
     */
    public static SwissUid of(UidPrefix prefix, int[] payload, int checkDigit) {
        int computed = requireCheckDigit(prefix, payload, checkDigit);
        if (computed != checkDigit) {
            throw new UidParseException(
                UidError.CHECK_DIGIT_MISMATCH,
                "'" + render(prefix, Nibbles.pack(payload), checkDigit, true)
                    + "' should have the check digit [" + computed + "]"
            );
        }
        return new SwissUid(prefix, Nibbles.pack(payload), (byte) computed);
    }

    // supplied: 메시지에 표시할 입력 검증 숫자, 없으면 -1
    private static int requireCheckDigit(UidPrefix prefix, int[] payload, int supplied) {
        if (prefix == null) {
            throw new IllegalArgumentException("prefix cannot be null");
        }
        if (payload == null || payload.length != CheckDigitCalculator.PAYLOAD_LENGTH) {
            throw new UidParseException(
                UidError.MALFORMED_DIGITS,
                "UID must have " + CheckDigitCalculator.PAYLOAD_LENGTH + " digits before the check digit"
                    + " (current: " + (payload == null ? "null" : payload.length) + ")"
            );
        }
        for (int digit : payload) {
            if (digit < 0 || digit > 9) {
                throw new UidParseException(
                    UidError.MALFORMED_DIGITS,
                    "UID digits must be between 0 and 9 (current: " + digit + ")"
                );
            }
        }
        if (payload[0] == 0) {
            throw new UidParseException(UidError.LEADING_ZERO, "Leading zero is not allowed");
        }

        OptionalInt computed = CheckDigitCalculator.calculate(payload);
        if (computed.isEmpty()) {
            throw new UidParseException(
                UidError.NO_VALID_CHECK_DIGIT,
                "'" + render(prefix, Nibbles.pack(payload), supplied, true) + "' is prohibited from use"
            );
        }
        return computed.getAsInt();
    }

    /**
     * 접두사 조회.
     *
     * @return 접두사
     */
    public UidPrefix prefix() {
        return prefix;
    }

    /**
     * 저장된 검증 숫자 조회 (재계산하지 않음).
     *
     * @return 검증 숫자 (0~9)
     */
    public int checkDigit() {
        return checkDigit;
    }

    /**
     * 8자리 payload 조회.
     *
     * @return payload 숫자 배열 (복사본)
     */
    public int[] payloadDigits() {
        return Nibbles.unpack(payload);
    }

    /**
     * 지정한 형식으로 출력.
     *
     * @param format 출력 형식
     * @return UID 문자열
     * @throws IllegalArgumentException format이 null인 경우
     */
    public String format(UidFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("format cannot be null");
        }
        String plain = render(prefix, payload, checkDigit, false);
        if (format.suffix() == null) {
            return plain;
        }
        return plain + ' ' + format.suffix();
    }

    /**
     * 기본 형식 ({@code CHE-109.322.551}).
     *
     * @return 15자 UID 문자열
     */
    public String toStringPlain() {
        return format(UidFormat.PLAIN);
    }

    /**
     * 상업등기부 형식 ({@code CHE-109.322.551 HR}).
     *
     * @return UID 문자열
     */
    public String toStringHr() {
        return format(UidFormat.HR);
    }

    /**
     * 부가가치세 형식 ({@code CHE-109.322.551 MWST}).
     *
     * @return UID 문자열
     */
    public String toStringMwst() {
        return format(UidFormat.MWST);
    }

    /**
     * 디버그 형식 ({@code CHE-109.322.55[1]}).
     *
     * <p>검증 숫자를 대괄호로 구분합니다. 파싱 대상 형식이 아닙니다.</p>
     *
     * @return 디버그 문자열
     */
    public String toDebugString() {
        return render(prefix, payload, checkDigit, true);
    }

    // checkDigit가 0~9 범위 밖이면 "?"로 표시
    private static String render(UidPrefix prefix, int packed, int checkDigit, boolean debug) {
        StringBuilder sb = new StringBuilder(18);
        sb.append(prefix.name()).append('-');
        for (int i = 0; i < Nibbles.DIGITS_PER_INT; i++) {
            if (i == 3 || i == 6) {
                sb.append('.');
            }
            sb.append(Nibbles.digitAt(packed, i));
        }
        String check = checkDigit < 0 || checkDigit > 9 ? "?" : String.valueOf(checkDigit);
        if (debug) {
            sb.append('[').append(check).append(']');
        } else {
            sb.append(check);
        }
        return sb.toString();
    }

    @Override
    public int compareTo(SwissUid other) {
        int result = Integer.compareUnsigned(payload, other.payload);
        if (result != 0) return result;
        result = Integer.compare(checkDigit, other.checkDigit);
        if (result != 0) return result;
        return prefix.compareTo(other.prefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SwissUid swissUid = (SwissUid) o;
        return payload == swissUid.payload
            && checkDigit == swissUid.checkDigit
            && prefix == swissUid.prefix;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * prefix.ordinal() + payload) + checkDigit;
    }

    @Override
    public String toString() {
        return toStringPlain();
    }
}
