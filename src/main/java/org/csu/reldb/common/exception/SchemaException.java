package org.csu.reldb.common.exception;

/**
 * 模式错误：表或列不存在、表名重复、建表时没有列等。
 */
public class SchemaException extends DatabaseException {

    public SchemaException(String message) {
        super(message);
    }
}
