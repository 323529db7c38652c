package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: 表示一个标识符，如表名或列名。
 * 支持可选的表限定符，如 "users.id"。
 *
 * @param tableQualifier 表限定符, e.g., "users" in "users.id"，可以为 null
 * @param name 标识符名称, e.g., "id" or "users"
 */
public record IdentifierNode(String tableQualifier, String name) implements AstNode {

    public IdentifierNode(String name) {
        this(null, name);
    }

    public boolean isQualified() {
        return tableQualifier != null;
    }

    public String getFullName() {
        return (tableQualifier != null ? tableQualifier + "." : "") + name;
    }

    @Override
    public String toString() {
        return "IdentifierNode[" + getFullName() + "]";
    }
}
