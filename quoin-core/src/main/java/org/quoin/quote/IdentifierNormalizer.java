package org.quoin.quote;

/**
 * 점(.)으로 구분된, 이미 따옴표가 있을 수도 있는 식별자를 Dialect 의 표준 따옴표로 다시 감싼다.
 *
 * <pre>
 *   schema.table      → "schema"."table"
 *   `table`.`col`     → "table"."col"
 *   *                 → *
 * </pre>
 *
 * 백틱(`)은 Dialect 와 상관없이 "이미 따옴표 처리됨" 표시로 취급한다.
 * 따옴표 없는 토큰 중간의 따옴표 문자(예: fo"o)는 특별히 다루지 않고 그대로 복사한다.
 */
public final class IdentifierNormalizer {

    private static final char SEPARATOR = '.';
    private static final String WILDCARD = "*";

    private IdentifierNormalizer() { /* static only */ }

    public static String normalize(String value, char prefix, char suffix) {
        StringBuilder buf = new StringBuilder(value == null ? 0 : value.length() + 8);
        normalizeTo(buf, value, prefix, suffix);
        return buf.toString();
    }

    /**
     * @param buf null 이면 아무것도 하지 않는다
     */
    public static void normalizeTo(StringBuilder buf, String value, char prefix, char suffix) {
        if (buf == null || value == null) {
            return;
        }

        String trimmed = trimSpace(value);
        if (trimmed.isEmpty()) {
            return;
        }
        if (WILDCARD.equals(trimmed)) {
            buf.append(WILDCARD);
            return;
        }

        int len = trimmed.length();
        int i = 0;
        while (i < len) {
            char c = trimmed.charAt(i);
            if (c == SEPARATOR) {
                buf.append(SEPARATOR);
                i++;
            } else if (c == prefix || c == QuoteChars.BACKTICK) {
                // 이미 감싸진 세그먼트: 닫는 문자까지 그대로 복사 (없으면 끝까지)
                char close = c == prefix ? suffix : QuoteChars.BACKTICK;
                i++;
                buf.append(prefix);
                while (i < len && trimmed.charAt(i) != close) {
                    buf.append(trimmed.charAt(i++));
                }
                buf.append(suffix);
                i++;
            } else {
                buf.append(prefix);
                while (i < len && trimmed.charAt(i) != SEPARATOR) {
                    buf.append(trimmed.charAt(i++));
                }
                buf.append(suffix);
            }
        }
    }

    private static String trimSpace(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isSpace(value.charAt(start))) {
            start++;
        }
        while (end > start && isSpace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    // Unicode White_Space. String.strip() misses U+0085, U+00A0, U+2007, U+202F
    // and treats U+001C..U+001F as space.
    static boolean isSpace(char c) {
        switch (c) {
            case '\t', '\n', '\u000B', '\f', '\r', ' ', '\u0085', '\u00A0',
                 '\u1680', '\u2028', '\u2029', '\u202F', '\u205F', '\u3000':
                return true;
            default:
                return c >= '\u2000' && c <= '\u200A';
        }
    }
}
