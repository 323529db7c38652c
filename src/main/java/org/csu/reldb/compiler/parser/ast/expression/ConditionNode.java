package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * WHERE 条件树的节点：{@link LogicalConditionNode} 或 {@link ComparisonConditionNode}。
 */
public interface ConditionNode extends AstNode {
}
