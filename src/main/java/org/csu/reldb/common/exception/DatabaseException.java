package org.csu.reldb.common.exception;

/**
 * 所有数据库错误的基类。
 * 消息是完整的句子，前端可以原样展示给用户。
 */
public abstract class DatabaseException extends RuntimeException {

    protected DatabaseException(String message) {
        super(message);
    }

    protected DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }
}
