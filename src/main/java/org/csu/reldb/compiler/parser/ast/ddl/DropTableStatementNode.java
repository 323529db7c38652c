package org.csu.reldb.compiler.parser.ast.ddl;

import org.csu.reldb.compiler.parser.ast.StatementKind;
import org.csu.reldb.compiler.parser.ast.StatementNode;
import org.csu.reldb.compiler.parser.ast.expression.IdentifierNode;

public record DropTableStatementNode(IdentifierNode tableName) implements StatementNode {

    @Override
    public StatementKind kind() {
        return StatementKind.DROP_TABLE;
    }
}
