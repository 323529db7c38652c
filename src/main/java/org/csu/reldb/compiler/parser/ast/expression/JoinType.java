package org.csu.reldb.compiler.parser.ast.expression;

public enum JoinType {
    INNER,
    LEFT,
    RIGHT
}
