package org.quoin.dialect;

import org.quoin.spi.dialect.Dialect;

import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 따옴표 쌍과 예약어 목록만으로 {@link Dialect} 를 구현하는 기반 클래스.
 * 예약어는 대문자로 저장하고 대소문자 구분 없이 비교한다.
 */
public abstract class AbstractDialect implements Dialect {
    private final char openQuote;
    private final char closeQuote;
    private final Set<String> keywords;

    protected AbstractDialect(char openQuote, char closeQuote, Set<String> keywords) {
        this.openQuote = openQuote;
        this.closeQuote = closeQuote;
        this.keywords = keywords.stream()
                .map(k -> k.toUpperCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public String quote(String raw) {
        return openQuote + raw + closeQuote;
    }

    @Override
    public boolean isReserved(String identifier) {
        return identifier != null && keywords.contains(identifier.toUpperCase(Locale.ROOT));
    }
}
