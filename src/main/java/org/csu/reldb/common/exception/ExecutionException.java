package org.csu.reldb.common.exception;

/**
 * 执行期错误：INSERT 列数与值数不一致、行引用越界，以及持久化失败。
 */
public class ExecutionException extends DatabaseException {

    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
