package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: UPDATE 语句中的 {@code column = literal}。
 */
public record SetClauseNode(IdentifierNode column, LiteralNode value) implements AstNode {
}
