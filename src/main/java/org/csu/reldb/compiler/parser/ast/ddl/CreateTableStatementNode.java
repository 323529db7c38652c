package org.csu.reldb.compiler.parser.ast.ddl;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.ColumnDefinitionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;

import java.util.List;

/**
 * 表示一个 CREATE TABLE 语句
 */
public record CreateTableStatementNode(
        IdentifierNode tableName,
        List<ColumnDefinitionNode> columns
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.CREATE_TABLE;
    }
}
