package org.csu.reldb.common.model;

import org.csu.reldb.common.exception.SchemaException;

/**
 * 列的声明类型。
 */
public enum DataType {
    INT,
    FLOAT,
    VARCHAR,
    BOOLEAN,
    DATETIME;

    /**
     * 将 SQL 中的类型关键字映射为 DataType，INTEGER 与 TIMESTAMP 作为别名。
     * @param sqlName 类型关键字（已大写）
     * @return 对应的 DataType
     */
    public static DataType fromSqlName(String sqlName) {
        return switch (sqlName.toUpperCase()) {
            case "INT", "INTEGER" -> INT;
            case "FLOAT" -> FLOAT;
            case "VARCHAR" -> VARCHAR;
            case "BOOLEAN" -> BOOLEAN;
            case "DATETIME", "TIMESTAMP" -> DATETIME;
            default -> throw new SchemaException("Unknown data type: " + sqlName);
        };
    }
}
