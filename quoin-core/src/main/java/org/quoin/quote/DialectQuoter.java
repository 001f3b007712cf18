package org.quoin.quote;

import org.quoin.spi.dialect.Dialect;

import java.util.Objects;

/**
 * Dialect / mode / policy 조합 하나를 나타내는 읽기 전용 {@link Quoter}.
 * Dialect 는 소유하지 않고 빌려 쓴다.
 */
public record DialectQuoter(Dialect dialect, QuoteMode quoteMode, QuotePolicy quotePolicy) implements Quoter {

    public DialectQuoter {
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(quoteMode, "quoteMode");
        Objects.requireNonNull(quotePolicy, "quotePolicy");
    }

    @Override
    public QuoteChars quotes() {
        return QuoteChars.of(dialect);
    }

    @Override
    public boolean isReserved(String value) {
        return dialect.isReserved(value);
    }
}
