package org.csu.reldb.compiler.parser.ast.expression;

/**
 * AST 节点: {@code column op literal}
 */
public record ComparisonConditionNode(
        IdentifierNode column,
        ComparisonOperator operator,
        LiteralNode value
) implements ConditionNode {
}
