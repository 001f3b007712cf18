package org.quoin.quote;

import org.quoin.spi.dialect.Dialect;

/**
 * Dialect 의 여는/닫는 따옴표 문자 쌍. MySQL 은 `...`, PostgreSQL 은 "...", SQL Server 는 [...]
 */
public record QuoteChars(char prefix, char suffix) {

    public static final char BACKTICK = '`';

    /**
     * 빈 문자열을 quote 해서 따옴표 쌍을 얻는다.
     *
     * @throws IllegalStateException Dialect 가 정확히 두 글자를 돌려주지 않을 때
     */
    public static QuoteChars of(Dialect dialect) {
        String quotes = dialect.quote("");
        if (quotes == null || quotes.length() != 2) {
            throw new IllegalStateException("Dialect " + dialect.getDatabaseType()
                    + " must quote the empty string as a 2-character pair but returned: " + quotes);
        }
        return new QuoteChars(quotes.charAt(0), quotes.charAt(1));
    }

    /** unquote 시 양 끝에서 제거할 문자들 */
    String trimSet() {
        return new String(new char[]{prefix, suffix, BACKTICK});
    }
}
