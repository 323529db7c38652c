package org.csu.reldb.compiler.parser.ast.expression;

/**
 * AST 节点: {@code left AND right} 或 {@code left OR right}
 */
public record LogicalConditionNode(
        LogicalOperator operator,
        ConditionNode left,
        ConditionNode right
) implements ConditionNode {
}
