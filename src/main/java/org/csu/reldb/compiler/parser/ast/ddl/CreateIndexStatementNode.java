package org.csu.reldb.compiler.parser.ast.ddl;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;

/**
 * 表示一个 CREATE INDEX 语句: {@code CREATE INDEX name ON table (column)}
 */
public record CreateIndexStatementNode(
        IdentifierNode indexName,
        IdentifierNode tableName,
        IdentifierNode columnName
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.CREATE_INDEX;
    }
}
