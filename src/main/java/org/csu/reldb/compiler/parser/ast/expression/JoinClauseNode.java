package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: {@code [INNER|LEFT|RIGHT] JOIN table ON left = right}
 *
 * @param left 连接条件左侧的列，可带表限定
 * @param right 连接条件右侧的列，可带表限定
 */
public record JoinClauseNode(
        JoinType joinType,
        IdentifierNode table,
        IdentifierNode left,
        IdentifierNode right
) implements AstNode {
}
