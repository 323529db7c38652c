package org.csu.reldb.engine;

import org.csu.reldb.catalog.Database;
import org.csu.reldb.compiler.lexer.Lexer;
import org.csu.reldb.compiler.parser.Parser;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 对外的查询入口：SQL 文本 -> 词法分析 -> 语法分析 -> 执行。
 * 每次调用都是独立的请求/响应，错误以 {@link org.csu.reldb.common.exception.DatabaseException} 抛出。
 */
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final Database database;
    private final ExecutionEngine executionEngine;

    public QueryExecutor(Database database) {
        this.database = database;
        this.executionEngine = new ExecutionEngine(database);
    }

    public Database getDatabase() {
        return database;
    }

    public QueryResult execute(String sql) {
        long start = System.nanoTime();
        Lexer lexer = new Lexer(sql);
        Parser parser = new Parser(lexer.tokenize());
        StatementNode statement = parser.parse();
        QueryResult result = executionEngine.execute(statement);
        log.debug("Executed {} on '{}' in {} ms: {}", statement.kind(), database.getName(),
                (System.nanoTime() - start) / 1_000_000, sql.trim());
        return result;
    }
}
