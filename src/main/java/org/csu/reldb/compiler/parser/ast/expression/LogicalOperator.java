package org.csu.reldb.compiler.parser.ast.expression;

public enum LogicalOperator {
    AND,
    OR
}
