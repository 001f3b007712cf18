package org.quoin.quote;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 따옴표 규칙을 어떤 종류의 식별자에 적용할지 결정한다.
 */
public enum QuoteMode {
    TABLE_AND_COLUMNS,
    TABLE_ONLY,
    COLUMNS_ONLY;

    /** 컬럼 식별자에 규칙을 적용하는 모드인지 */
    public boolean appliesToColumns() {
        return this == TABLE_AND_COLUMNS || this == COLUMNS_ONLY;
    }

    /** 테이블 식별자에 규칙을 적용하는 모드인지 */
    public boolean appliesToTables() {
        return this == TABLE_AND_COLUMNS || this == TABLE_ONLY;
    }

    /**
     * 설정 문자열을 모드로 변환한다. 대소문자를 구분하지 않으며 '-', '_', 공백을 같은 구분자로 본다.
     *
     * @param value "table-and-columns", "TABLE_ONLY", "columns only" 등
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static QuoteMode from(String value) {
        if (value != null) {
            String key = value.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
            for (QuoteMode mode : values()) {
                if (mode.name().equals(key)) {
                    return mode;
                }
            }
        }
        throw new IllegalArgumentException("Unknown quote mode: " + value + " (expected one of "
                + Arrays.stream(values()).map(QuoteMode::toOptionValue).collect(Collectors.joining(", ")) + ")");
    }

    /** 설정 파일/CLI 에서 쓰는 표기 (예: table-and-columns) */
    public String toOptionValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
