package org.quoin.dialect.postgresql;

import org.quoin.dialect.AbstractDialect;
import org.quoin.dialect.DatabaseType;

import java.util.Set;

/**
 * PostgreSQL: 큰따옴표로 감싼다.
 * 예약어에는 완전 예약어와 "함수/타입 이름으로는 쓸 수 있음" 으로 분류된 키워드를 모두 포함한다.
 */
public class PostgreSqlDialect extends AbstractDialect {

    private static final Set<String> KEYWORDS = Set.of(
            // reserved
            "ALL", "ANALYSE", "ANALYZE", "AND", "ANY", "ARRAY", "AS", "ASC",
            "ASYMMETRIC", "BOTH", "CASE", "CAST", "CHECK", "COLLATE", "COLUMN",
            "CONSTRAINT", "CREATE", "CURRENT_CATALOG", "CURRENT_DATE", "CURRENT_ROLE",
            "CURRENT_TIME", "CURRENT_TIMESTAMP", "CURRENT_USER", "DEFAULT", "DEFERRABLE",
            "DESC", "DISTINCT", "DO", "ELSE", "END", "EXCEPT", "FALSE", "FETCH", "FOR",
            "FOREIGN", "FROM", "GRANT", "GROUP", "HAVING", "IN", "INITIALLY", "INTERSECT",
            "INTO", "LATERAL", "LEADING", "LIMIT", "LOCALTIME", "LOCALTIMESTAMP", "NOT",
            "NULL", "OFFSET", "ON", "ONLY", "OR", "ORDER", "PLACING", "PRIMARY",
            "REFERENCES", "RETURNING", "SELECT", "SESSION_USER", "SOME", "SYMMETRIC",
            "TABLE", "THEN", "TO", "TRAILING", "TRUE", "UNION", "UNIQUE", "USER", "USING",
            "VARIADIC", "WHEN", "WHERE", "WINDOW", "WITH",
            // reserved (can be function or type)
            "AUTHORIZATION", "BINARY", "COLLATION", "CONCURRENTLY", "CROSS",
            "CURRENT_SCHEMA", "FREEZE", "FULL", "ILIKE", "INNER", "IS", "ISNULL", "JOIN",
            "LEFT", "LIKE", "NATURAL", "NOTNULL", "OUTER", "OVERLAPS", "RIGHT", "SIMILAR",
            "TABLESAMPLE", "VERBOSE"
    );

    public PostgreSqlDialect() {
        super('"', '"', KEYWORDS);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.POSTGRESQL;
    }
}
