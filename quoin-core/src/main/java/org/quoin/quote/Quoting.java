package org.quoin.quote;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * {@link Quoter} 설정에 따라 식별자에 따옴표를 붙이는 진입점.
 * 단일 값, 콤마로 구분된 컬럼 목록, 임의의 quote 함수를 쓰는 일괄 처리를 제공한다.
 *
 * <p>모든 메서드는 입력을 변경하지 않고 새 문자열/리스트를 만든다.
 */
public final class Quoting {

    private static final String COLUMN_SEPARATOR = ",";

    private Quoting() { /* static only */ }

    /**
     * 정책이 허락하면 식별자를 정규화해서 따옴표를 붙이고, 아니면 입력을 그대로 돌려준다.
     *
     * @param quoter   Dialect 와 mode/policy 를 제공
     * @param value    "name", "schema.table", "`t`.`c`", "*" 등
     * @param isColumn 컬럼이면 true, 테이블이면 false
     */
    public static String quote(Quoter quoter, String value, boolean isColumn) {
        StringBuilder buf = new StringBuilder();
        quoteTo(quoter, buf, value, isColumn);
        return buf.toString();
    }

    /**
     * {@link #quote(Quoter, String, boolean)} 결과를 {@code buf} 에 덧붙인다.
     * buf 나 value 가 null 이면 아무것도 쓰지 않는다.
     */
    public static void quoteTo(Quoter quoter, StringBuilder buf, String value, boolean isColumn) {
        if (buf == null || value == null) {
            return;
        }
        if (!QuotePolicyResolver.shouldQuote(quoter, value, isColumn)) {
            buf.append(value);
            return;
        }
        QuoteChars quotes = quoter.quotes();
        IdentifierNormalizer.normalizeTo(buf, value, quotes.prefix(), quotes.suffix());
    }

    /**
     * "a,b,c" 처럼 콤마로 구분된 컬럼 목록의 각 항목을 컬럼으로 quote 한 뒤 "," 로 다시 잇는다.
     * 빈 항목도 유지한다 ("a,,b" → 3개).
     */
    public static String quoteColumns(Quoter quoter, String columns) {
        if (columns == null) {
            return "";
        }
        return quoteJoin(quoter, Arrays.asList(columns.split(COLUMN_SEPARATOR, -1)));
    }

    /**
     * 각 항목을 컬럼으로 quote 해서 "," 로 잇는다. (공백 없음)
     */
    public static String quoteJoin(Quoter quoter, List<String> columns) {
        List<String> quoted = new ArrayList<>(columns.size());
        for (String column : columns) {
            quoted.add(quote(quoter, column, true));
        }
        return String.join(COLUMN_SEPARATOR, quoted);
    }

    /**
     * 임의의 quote 함수를 모든 항목에 적용한 뒤 {@code separator + " "} 로 잇는다.
     *
     * <pre>
     *   quoteJoinFunc(List.of("a", "b"), engine::quote, ",") → "`a`, `b`"
     * </pre>
     */
    public static String quoteJoinFunc(List<String> items, Function<String, String> quoteFunc, String separator) {
        List<String> quoted = new ArrayList<>(items.size());
        for (String item : items) {
            quoted.add(quoteFunc.apply(item));
        }
        return String.join(separator + " ", quoted);
    }

    /**
     * 양 끝에서 Dialect 따옴표와 백틱을 모두 걷어낸다. 구조를 해석하지 않는 단순 trim 이다.
     *
     * <pre>
     *   "`users`"          → users
     *   "\"a\".\"b\""      → a"."b
     * </pre>
     */
    public static String unquote(Quoter quoter, String value) {
        if (value == null) {
            return null;
        }
        String trimSet = quoter.quotes().trimSet();
        int start = 0;
        int end = value.length();
        while (start < end && trimSet.indexOf(value.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && trimSet.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(start, end);
    }
}
