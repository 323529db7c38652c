package org.csu.reldb.compiler.parser.ast.dml;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.ConditionNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;
import org.csu.reldb.compiler.parser.ast.expression.SetClauseNode;

import java.util.List;

public record UpdateStatementNode(
        IdentifierNode tableName,
        List<SetClauseNode> setClauses,
        ConditionNode whereClause
) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.UPDATE;
    }
}
