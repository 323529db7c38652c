package org.csu.reldb.compiler.parser.ast.dml;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;

public record DeleteStatementNode(
        IdentifierNode tableName,
        ConditionNode whereClause
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.DELETE;
    }
}
