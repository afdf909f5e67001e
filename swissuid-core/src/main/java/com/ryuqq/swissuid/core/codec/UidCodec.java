package com.ryuqq.swissuid.core.codec;

import com.ryuqq.swissuid.core.model.SwissUid;
import com.ryuqq.swissuid.core.model.UidError;
import com.ryuqq.swissuid.core.model.UidFormat;
import com.ryuqq.swissuid.core.model.UidParseException;
import com.ryuqq.swissuid.core.model.UidPrefix;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * UID 문자열 파싱 및 출력.
 *
 * <p><strong>허용 입력 형식:</strong></p>
 * <pre>
 * uid    := prefix [ "-" ] digits [ " " suffix ]
 * prefix := "CHE" | "ADM"
 * digits := DDD "." DDD "." DDD     (그룹 형식, 마지막 숫자가 검증 숫자)
 *         | DDDDDDDDD               (연속 형식)
 * suffix := "HR" | "MWST"
 * </pre>
 *
 * <p>대소문자를 구분하며, 앞뒤 공백은 허용하지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. 접두사 확인                 → INVALID_PREFIX
 * 2. 접미사 분리, 숫자 구조 확인  → MALFORMED_DIGITS
 * 3. 첫 번째 숫자 0              → LEADING_ZERO
 * 4. 검증 숫자 계산 불가          → NO_VALID_CHECK_DIGIT
 * 5. 검증 숫자 불일치            → CHECK_DIGIT_MISMATCH
 * 6. SwissUid 반환
 * </pre>
 *
 * @author SwissUid Team
 * @since 1.0.0
 */
public final class UidCodec {

    private static final Pattern GROUPED = Pattern.compile("(\\d{3})\\.(\\d{3})\\.(\\d{3})");
    private static final Pattern CONTIGUOUS = Pattern.compile("\\d{9}");

    private UidCodec() {
    }

    /**
     * 문자열을 검증하여 SwissUid 생성.
     *
     * @param text UID 문자열
     * @return 검증된 SwissUid
     * @throws UidParseException 검증 실패 시 ({@link UidParseException#error()}로 원인 확인)
     */
    public static SwissUid parse(String text) {
        if (text == null) {
            throw new UidParseException(UidError.INVALID_PREFIX, "UID cannot be null");
        }
        if (text.length() < UidPrefix.LENGTH) {
            throw new UidParseException(
                UidError.INVALID_PREFIX,
                "UID is too short to contain a prefix (current: '" + text + "')"
            );
        }
        UidPrefix prefix = UidPrefix.of(text.substring(0, UidPrefix.LENGTH));

        String body = stripSuffix(text.substring(UidPrefix.LENGTH));
        if (body.startsWith("-")) {
            body = body.substring(1);
        }

        String digits = extractDigits(body, text);
        int[] payload = new int[digits.length() - 1];
        for (int i = 0; i < payload.length; i++) {
            payload[i] = digits.charAt(i) - '0';
        }
        int checkDigit = digits.charAt(digits.length() - 1) - '0';

        return SwissUid.of(prefix, payload, checkDigit);
    }

    /**
     * 문자열을 검증하여 결과 객체로 반환 (예외 없음).
     *
     * @param text UID 문자열
     * @return {@link Parsed} 또는 {@link Rejected}
     */
    public static ParseResult tryParse(String text) {
        try {
            return new Parsed(parse(text));
        } catch (UidParseException e) {
            return new Rejected(e.error(), e.getMessage());
        }
    }

    /**
     * 문자열이 유효한 UID인지 확인.
     *
     * @param text UID 문자열
     * @return 유효하면 true
     */
    public static boolean isValid(String text) {
        return tryParse(text).isParsed();
    }

    /**
     * 지정한 형식으로 출력.
     *
     * @param uid SwissUid
     * @param format 출력 형식
     * @return UID 문자열
     * @throws IllegalArgumentException uid 또는 format이 null인 경우
     */
    public static String format(SwissUid uid, UidFormat format) {
        if (uid == null) {
            throw new IllegalArgumentException("uid cannot be null");
        }
        return uid.format(format);
    }

    private static String stripSuffix(String rest) {
        int space = rest.indexOf(' ');
        if (space < 0) {
            return rest;
        }
        String token = rest.substring(space + 1);
        if (UidFormat.fromSuffix(token) == null) {
            throw new UidParseException(
                UidError.MALFORMED_DIGITS,
                "Suffix must be 'HR' or 'MWST' (current: '" + token + "')"
            );
        }
        return rest.substring(0, space);
    }

    // 9자리 숫자 문자열 (payload 8 + 검증 숫자 1)
    private static String extractDigits(String body, String text) {
        Matcher grouped = GROUPED.matcher(body);
        if (grouped.matches()) {
            return grouped.group(1) + grouped.group(2) + grouped.group(3);
        }
        if (CONTIGUOUS.matcher(body).matches()) {
            return body;
        }
        throw new UidParseException(
            UidError.MALFORMED_DIGITS,
            "UID must have 9 digits in the form XXX.XXX.XXX or XXXXXXXXX (current: '" + text + "')"
        );
    }
}
