package org.csu.reldb.compiler.parser.ast.expression;

import org.csu.reldb.common.model.DataType;
import org.csu.reldb.compiler.parser.ast.AstNode;

/**
 * AST 节点: CREATE TABLE 中的一个列定义。
 *
 * @param length VARCHAR 的长度，未指定时为 null
 * @param defaultValue DEFAULT 字面量，未指定时为 null
 */
public record ColumnDefinitionNode(
        IdentifierNode columnName,
        DataType dataType,
        Integer length,
        boolean primaryKey,
        boolean unique,
        boolean notNull,
        LiteralNode defaultValue
) implements AstNode {
}
