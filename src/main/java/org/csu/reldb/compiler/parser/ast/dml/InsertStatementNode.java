package org.csu.reldb.compiler.parser.ast.dml;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.LiteralNode;

import java.util.List;

/**
 * 表示一个 INSERT 语句
 *
 * @param columns 显式列出的列，省略时为空列表
 */
public record InsertStatementNode(
        IdentifierNode tableName,
        List<IdentifierNode> columns,
        List<LiteralNode> values
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.INSERT;
    }
}
