package org.quoin.spi.dialect;

import org.quoin.dialect.DatabaseType;

/**
 * quote 엔진이 사용하는 Dialect 계약.
 */
public interface Dialect {
    DatabaseType getDatabaseType();

    /**
     * raw 를 Dialect 의 따옴표 쌍으로 감싼다. {@code quote("")} 는 따옴표 두 글자를 돌려줘야 한다.
     */
    String quote(String raw);

    boolean isReserved(String identifier);   // 예약어 확인
}
