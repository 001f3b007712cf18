package org.quoin.quote;

import java.util.function.Predicate;

/**
 * mode × policy × 예약어 여부로 식별자에 따옴표를 붙일지 결정한다.
 * 부수 효과가 없는 순수 함수만 가진다.
 */
public final class QuotePolicyResolver {

    private QuotePolicyResolver() { /* static only */ }

    /**
     * @param isColumn   컬럼 식별자이면 true, 테이블 식별자이면 false
     * @param mode       적용 대상
     * @param policy     적용 시점
     * @param value      호출자가 넘긴 값 그대로 (trim 하지 않음)
     * @param isReserved 예약어 판별식. ADD_RESERVED 이고 mode 가 맞을 때만 호출된다
     * @return 정규화해서 따옴표를 붙여야 하면 true. false 이면 값은 그대로 출력된다
     */
    public static boolean shouldQuote(boolean isColumn,
                                      QuoteMode mode,
                                      QuotePolicy policy,
                                      String value,
                                      Predicate<String> isReserved) {

        boolean applies = isColumn ? mode.appliesToColumns() : mode.appliesToTables();
        if (!applies) {
            return false;
        }

        return switch (policy) {
            case ADD_ALWAYS -> true;
            case ADD_RESERVED -> isReserved.test(value);
            case NO_ADD -> false;
        };
    }

    public static boolean shouldQuote(Quoter quoter, String value, boolean isColumn) {
        return shouldQuote(isColumn, quoter.quoteMode(), quoter.quotePolicy(), value, quoter::isReserved);
    }
}
