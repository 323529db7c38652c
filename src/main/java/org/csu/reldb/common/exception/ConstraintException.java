package org.csu.reldb.common.exception;

/**
 * 约束错误：NOT NULL、PRIMARY KEY / UNIQUE 重复、VARCHAR 超长、类型转换失败。
 */
public class ConstraintException extends DatabaseException {

    public ConstraintException(String message) {
        super(message);
    }
}
