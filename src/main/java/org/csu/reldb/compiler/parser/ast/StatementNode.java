package org.csu.reldb.compiler.parser.ast;

/**
 * 语句节点：一条完整的 SQL 语句。
 */
public interface StatementNode extends AstNode {

    StatementKind kind();
}
