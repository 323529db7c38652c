package org.csu.reldb.common.model;

/**
 * 运行时标量值的类型标签。
 */
public enum ValueType {
    NULL,
    BOOL,
    INT,
    FLOAT,
    TIMESTAMP,
    TEXT;

    public boolean isNumeric() {
        return this == INT || this == FLOAT;
    }

    /**
     * 跨类型比较时的排序等级，INT 与 FLOAT 同级。
     */
    int rank() {
        return switch (this) {
            case NULL -> 0;
            case BOOL -> 1;
            case INT, FLOAT -> 2;
            case TIMESTAMP -> 3;
            case TEXT -> 4;
        };
    }
}
