package org.quoin.quote;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 따옴표를 언제 붙일지 결정한다: 항상, 절대 안 함, 예약어일 때만.
 */
public enum QuotePolicy {
    ADD_ALWAYS,
    NO_ADD,
    ADD_RESERVED;

    /**
     * 설정 문자열을 정책으로 변환한다. 규칙은 {@link QuoteMode#from(String)} 과 같다.
     *
     * @throws IllegalArgumentException 알 수 없는 값
     */
    public static QuotePolicy from(String value) {
        if (value != null) {
            String key = value.trim().replace('-', '_').replace(' ', '_').toUpperCase(Locale.ROOT);
            for (QuotePolicy policy : values()) {
                if (policy.name().equals(key)) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown quote policy: " + value + " (expected one of "
                + Arrays.stream(values()).map(QuotePolicy::toOptionValue).collect(Collectors.joining(", ")) + ")");
    }

    public String toOptionValue() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
