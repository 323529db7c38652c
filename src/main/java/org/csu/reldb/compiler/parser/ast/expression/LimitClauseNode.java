package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: 表示 LIMIT 子句
 */
public record LimitClauseNode(int limit) implements AstNode {
}
