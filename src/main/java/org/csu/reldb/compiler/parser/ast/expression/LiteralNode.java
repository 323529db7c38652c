package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.common.model.Value;
import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: 表示一个字面量，解析时已转换为 Value。
 */
public record LiteralNode(Value value) implements AstNode {
}
