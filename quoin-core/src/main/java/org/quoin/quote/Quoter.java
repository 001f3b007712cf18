package org.quoin.quote;

/**
 * 식별자에 따옴표를 붙이는 데 필요한 정보를 제공하는 객체.
 * {@link DialectQuoter} 와 {@link QuotingEngine} 이 구현한다.
 */
public interface Quoter {
    QuoteChars quotes();                 // Dialect 의 따옴표 쌍
    QuoteMode quoteMode();               // 어떤 식별자에 적용할지
    QuotePolicy quotePolicy();           // 언제 붙일지
    boolean isReserved(String value);    // Dialect 예약어 확인
}
