package org.quoin.quote;

import lombok.Builder;
import lombok.NonNull;
import org.quoin.options.QuoinOptions;
import org.quoin.spi.dialect.Dialect;

import java.util.List;
import java.util.Map;

/**
 * 활성 Dialect 하나와 mode/policy 를 소유하고, SQL 빌더에 quote 기능을 제공한다.
 * 생성 후에는 설정이 바뀌지 않으므로 여러 스레드에서 동기화 없이 사용할 수 있다.
 */
@Builder
public class QuotingEngine implements Quoter {

    @NonNull
    private final Dialect dialect;

    @NonNull
    @Builder.Default
    private final QuoteMode quoteMode = QuoteMode.TABLE_AND_COLUMNS;

    @NonNull
    @Builder.Default
    private final QuotePolicy quotePolicy = QuotePolicy.ADD_ALWAYS;

    /**
     * {@code ConfigurationLoader} 가 만든 설정 맵의 mode/policy 로 엔진을 만든다.
     * 값이 없으면 기본값(table-and-columns / add-always)을 쓴다.
     *
     * @throws IllegalArgumentException mode 나 policy 값을 해석할 수 없을 때
     */
    public static QuotingEngine fromConfiguration(Dialect dialect, Map<String, String> config) {
        String mode = config.getOrDefault(QuoinOptions.Quote.MODE_KEY, QuoinOptions.Quote.MODE_DEFAULT);
        String policy = config.getOrDefault(QuoinOptions.Quote.POLICY_KEY, QuoinOptions.Quote.POLICY_DEFAULT);
        return QuotingEngine.builder()
                .dialect(dialect)
                .quoteMode(QuoteMode.from(mode))
                .quotePolicy(QuotePolicy.from(policy))
                .build();
    }

    public Dialect getDialect() {
        return dialect;
    }

    @Override
    public QuoteChars quotes() {
        return QuoteChars.of(dialect);
    }

    @Override
    public QuoteMode quoteMode() {
        return quoteMode;
    }

    @Override
    public QuotePolicy quotePolicy() {
        return quotePolicy;
    }

    @Override
    public boolean isReserved(String value) {
        return dialect.isReserved(value);
    }

    public String quote(String value, boolean isColumn) {
        return Quoting.quote(this, value, isColumn);
    }

    /** 컬럼 식별자로 quote */
    public String quote(String value) {
        return quote(value, true);
    }

    public void quoteTo(StringBuilder buf, String value, boolean isColumn) {
        Quoting.quoteTo(this, buf, value, isColumn);
    }

    public String quoteColumns(String columns) {
        return Quoting.quoteColumns(this, columns);
    }

    public String quoteJoin(List<String> columns) {
        return Quoting.quoteJoin(this, columns);
    }

    /** 컬럼으로 quote 한 뒤 {@code separator + " "} 로 잇는다. */
    public String quoteJoinFunc(List<String> columns, String separator) {
        return Quoting.quoteJoinFunc(columns, this::quote, separator);
    }

    public String unquote(String value) {
        return Quoting.unquote(this, value);
    }
}
