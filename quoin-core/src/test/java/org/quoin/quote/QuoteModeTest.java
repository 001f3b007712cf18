package org.quoin.quote;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class QuoteModeTest {

    @DisplayName("설정 문자열 → QuoteMode")
    @ParameterizedTest
    @CsvSource({
        "table-and-columns, TABLE_AND_COLUMNS",
        "TABLE_ONLY, TABLE_ONLY",
        "'columns only', COLUMNS_ONLY",
        "' Table-Only ', TABLE_ONLY"
    })
    void mode_from(String input, QuoteMode expected) {
        assertThat(QuoteMode.from(input)).isEqualTo(expected);
    }

    @DisplayName("설정 문자열 → QuotePolicy")
    @ParameterizedTest
    @CsvSource({
        "add-always, ADD_ALWAYS",
        "NO_ADD, NO_ADD",
        "'add reserved', ADD_RESERVED"
    })
    void policy_from(String input, QuotePolicy expected) {
        assertThat(QuotePolicy.from(input)).isEqualTo(expected);
    }

    @Test
    @DisplayName("알 수 없는 값은 허용 값 목록과 함께 IllegalArgumentException")
    void unknownValue() {
        assertThatThrownBy(() -> QuoteMode.from("everything"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("everything")
                .hasMessageContaining("table-and-columns, table-only, columns-only");
        assertThatThrownBy(() -> QuotePolicy.from(null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("add-always, no-add, add-reserved");
    }

    @Test
    @DisplayName("모드별 적용 대상")
    void appliesTo() {
        assertThat(QuoteMode.TABLE_AND_COLUMNS.appliesToTables()).isTrue();
        assertThat(QuoteMode.TABLE_AND_COLUMNS.appliesToColumns()).isTrue();
        assertThat(QuoteMode.TABLE_ONLY.appliesToColumns()).isFalse();
        assertThat(QuoteMode.COLUMNS_ONLY.appliesToTables()).isFalse();
    }

    @Test
    @DisplayName("toOptionValue 는 from 으로 다시 읽을 수 있는 표기")
    void optionValue() {
        assertThat(QuoteMode.COLUMNS_ONLY.toOptionValue()).isEqualTo("columns-only");
        assertThat(QuotePolicy.ADD_RESERVED.toOptionValue()).isEqualTo("add-reserved");
    }
}
