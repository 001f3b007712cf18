package org.quoin.dialect.mysql;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.quoin.dialect.DatabaseType;
import org.quoin.quote.QuotePolicy;
import org.quoin.quote.QuotingEngine;

import static org.junit.jupiter.api.Assertions.*;

class MySqlDialectTest {

    private final MySqlDialect dialect = new MySqlDialect();

    @Test
    @DisplayName("quote는 backtick(`)으로 감싼다")
    void quote_wrapsWithBacktick() {
        assertEquals("``", dialect.quote(""));
        assertEquals("`users`", dialect.quote("users"));
    }

    @Test
    @DisplayName("isReserved는 MySQL 예약어를 대소문자 무관하게 식별한다")
    void isReserved_detectsReserved() {
        assertTrue(dialect.isReserved("SELECT"));
        assertTrue(dialect.isReserved("table"));
        assertTrue(dialect.isReserved("Window"));
        assertFalse(dialect.isReserved("notAKeyword"));
        assertFalse(dialect.isReserved(null));
    }

    @Test
    @DisplayName("isReserved 는 MySqlUtil.isKeyword 와 같은 판정을 내린다")
    void isReserved_matchesMySqlUtil() {
        for (String word : new String[]{"select", "Order", "KEY", "users", "utc_date", "", null}) {
            assertEquals(MySqlUtil.isKeyword(word), dialect.isReserved(word), String.valueOf(word));
        }
    }

    @Test
    @DisplayName("DatabaseType 은 MYSQL")
    void databaseType() {
        assertEquals(DatabaseType.MYSQL, dialect.getDatabaseType());
    }

    @Test
    @DisplayName("ADD_RESERVED 엔진은 예약어 컬럼만 감싼다")
    void engine_addReserved() {
        QuotingEngine engine = QuotingEngine.builder()
                .dialect(dialect)
                .quotePolicy(QuotePolicy.ADD_RESERVED)
                .build();

        assertEquals("id,`key`,name,`order`", engine.quoteColumns("id,key,name,order"));
    }
}
