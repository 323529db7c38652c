package org.csu.reldb.compiler.lexer;

/**
 * 词法单元的大类。
 */
public enum TokenCategory {
    KEYWORD,
    IDENTIFIER,
    STRING,
    NUMBER,
    OPERATOR,
    PUNCT,
    EOF
}
