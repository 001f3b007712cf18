package org.quoin.dialect;

public enum DatabaseType {
    MYSQL,
    POSTGRESQL,
    MSSQL
}
