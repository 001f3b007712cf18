package org.quoin.quote;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quoin.dialect.mssql.MsSqlDialect;
import org.quoin.dialect.mysql.MySqlDialect;
import org.quoin.options.QuoinOptions;
import org.quoin.spi.dialect.Dialect;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuotingEngineTest {

    @Mock
    Dialect dialect;

    @Test
    @DisplayName("기본 mode/policy 는 TABLE_AND_COLUMNS / ADD_ALWAYS")
    void builder_defaults() {
        QuotingEngine engine = QuotingEngine.builder().dialect(new MySqlDialect()).build();

        assertThat(engine.quoteMode()).isEqualTo(QuoteMode.TABLE_AND_COLUMNS);
        assertThat(engine.quotePolicy()).isEqualTo(QuotePolicy.ADD_ALWAYS);
        assertThat(engine.quote("users", false)).isEqualTo("`users`");
    }

    @Test
    @DisplayName("Dialect 없이 만들 수 없다")
    void builder_requiresDialect() {
        assertThatThrownBy(() -> QuotingEngine.builder().build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("dialect");
    }

    @Test
    @DisplayName("따옴표 쌍과 예약어 판별은 Dialect 에 위임한다")
    void forwardsToDialect() {
        when(dialect.quote("")).thenReturn("\"\"");
        when(dialect.isReserved("select")).thenReturn(true);
        when(dialect.isReserved("users")).thenReturn(false);

        QuotingEngine engine = QuotingEngine.builder()
                .dialect(dialect)
                .quotePolicy(QuotePolicy.ADD_RESERVED)
                .build();

        assertThat(engine.quotes()).isEqualTo(new QuoteChars('"', '"'));
        assertThat(engine.isReserved("select")).isTrue();
        assertThat(engine.quote("select", true)).isEqualTo("\"select\"");
        assertThat(engine.quote("users", true)).isEqualTo("users");

        verify(dialect, atLeastOnce()).isReserved("select");
        verify(dialect).isReserved("users");
    }

    @Test
    @DisplayName("Dialect 가 두 글자 따옴표 쌍을 주지 않으면 IllegalStateException")
    void invalidQuotePair_isRejected() {
        when(dialect.quote("")).thenReturn("'");

        QuotingEngine engine = QuotingEngine.builder().dialect(dialect).build();

        assertThatThrownBy(() -> engine.quote("users", true))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("2-character");
    }

    @Test
    @DisplayName("NO_ADD 면 Dialect 를 전혀 조회하지 않는다")
    void noAdd_doesNotTouchDialect() {
        QuotingEngine engine = QuotingEngine.builder()
                .dialect(dialect)
                .quotePolicy(QuotePolicy.NO_ADD)
                .build();

        assertThat(engine.quote("`a`.b", true)).isEqualTo("`a`.b");
        verifyNoInteractions(dialect);
    }

    @Test
    @DisplayName("일괄 처리와 unquote 편의 메서드")
    void batchConveniences() {
        QuotingEngine engine = QuotingEngine.builder().dialect(new MsSqlDialect()).build();

        assertThat(engine.quote("dbo.users")).isEqualTo("[dbo].[users]");
        assertThat(engine.quoteColumns("id,name")).isEqualTo("[id],[name]");
        assertThat(engine.quoteJoin(List.of("id", "`name`"))).isEqualTo("[id],[name]");
        assertThat(engine.quoteJoinFunc(List.of("id", "name"), ",")).isEqualTo("[id], [name]");
        assertThat(engine.unquote("[users]")).isEqualTo("users");

        StringBuilder sql = new StringBuilder("DELETE FROM ");
        engine.quoteTo(sql, "dbo.users", false);
        assertThat(sql).hasToString("DELETE FROM [dbo].[users]");
    }

    @Test
    @DisplayName("설정 맵에서 mode/policy 를 읽어 엔진을 만든다")
    void fromConfiguration() {
        QuotingEngine engine = QuotingEngine.fromConfiguration(new MySqlDialect(), Map.of(
                QuoinOptions.Quote.MODE_KEY, "columns-only",
                QuoinOptions.Quote.POLICY_KEY, "add-reserved"));

        assertThat(engine.quoteMode()).isEqualTo(QuoteMode.COLUMNS_ONLY);
        assertThat(engine.quotePolicy()).isEqualTo(QuotePolicy.ADD_RESERVED);
        assertThat(engine.quote("order", true)).isEqualTo("`order`");
        assertThat(engine.quote("order", false)).isEqualTo("order");
    }

    @Test
    @DisplayName("설정 값이 없으면 기본값, 잘못된 값이면 IllegalArgumentException")
    void fromConfiguration_defaultsAndErrors() {
        QuotingEngine engine = QuotingEngine.fromConfiguration(new MySqlDialect(), Map.of());
        assertThat(engine.quoteMode()).isEqualTo(QuoteMode.TABLE_AND_COLUMNS);
        assertThat(engine.quotePolicy()).isEqualTo(QuotePolicy.ADD_ALWAYS);

        assertThatThrownBy(() -> QuotingEngine.fromConfiguration(new MySqlDialect(),
                Map.of(QuoinOptions.Quote.POLICY_KEY, "sometimes")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sometimes");
    }

    @Test
    @DisplayName("독립 Quoter 와 같은 결과를 낸다")
    void sameResultAsDialectQuoter() {
        MySqlDialect mysql = new MySqlDialect();
        QuotingEngine engine = QuotingEngine.builder()
                .dialect(mysql)
                .quoteMode(QuoteMode.TABLE_ONLY)
                .quotePolicy(QuotePolicy.ADD_ALWAYS)
                .build();
        Quoter standalone = new DialectQuoter(mysql, QuoteMode.TABLE_ONLY, QuotePolicy.ADD_ALWAYS);

        for (String value : List.of("users", "s.t", "\"x\"", "*")) {
            assertThat(engine.quote(value, false)).isEqualTo(Quoting.quote(standalone, value, false));
            assertThat(engine.quote(value, true)).isEqualTo(Quoting.quote(standalone, value, true));
        }
        assertThat(engine.getDialect()).isSameAs(mysql);
    }
}
