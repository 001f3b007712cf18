package org.quoin.dialect.mysql;

import org.quoin.dialect.AbstractDialect;
import org.quoin.dialect.DatabaseType;

public class MySqlDialect extends AbstractDialect {

    public MySqlDialect() {
        super('`', '`', MySqlUtil.MYSQL_KEYWORDS);
    }

    @Override
    public boolean isReserved(String identifier) {
        return MySqlUtil.isKeyword(identifier);
    }

    @Override
    public DatabaseType getDatabaseType() {
        return DatabaseType.MYSQL;
    }
}
