package org.csu.reldb.compiler.lexer;

/**
 * 词法单元的类型 (种别码)。
 */
public enum TokenType {
    // 关键字
    SELECT, FROM, WHERE, INSERT, INTO, VALUES, UPDATE, SET, DELETE,
    CREATE, TABLE, DROP, INDEX, ON,
    PRIMARY, KEY, UNIQUE, NOT, NULL, DEFAULT,
    AND, OR,
    JOIN, INNER, LEFT, RIGHT, OUTER,
    ORDER, BY, ASC, DESC, LIMIT,
    INT, INTEGER, VARCHAR, FLOAT, BOOLEAN, DATETIME, TIMESTAMP,
    TRUE, FALSE,

    // 标识符与字面量
    IDENTIFIER(TokenCategory.IDENTIFIER),
    STRING_CONST(TokenCategory.STRING),
    INTEGER_CONST(TokenCategory.NUMBER),
    DECIMAL_CONST(TokenCategory.NUMBER),

    // 运算符
    EQUAL(TokenCategory.OPERATOR),
    NOT_EQUAL(TokenCategory.OPERATOR),
    LESS(TokenCategory.OPERATOR),
    LESS_EQUAL(TokenCategory.OPERATOR),
    GREATER(TokenCategory.OPERATOR),
    GREATER_EQUAL(TokenCategory.OPERATOR),
    BANG(TokenCategory.OPERATOR),

    // 分隔符
    LPAREN(TokenCategory.PUNCT),
    RPAREN(TokenCategory.PUNCT),
    COMMA(TokenCategory.PUNCT),
    SEMICOLON(TokenCategory.PUNCT),
    DOT(TokenCategory.PUNCT),
    ASTERISK(TokenCategory.PUNCT),

    EOF(TokenCategory.EOF);

    private final TokenCategory category;

    TokenType() {
        this(TokenCategory.KEYWORD);
    }

    TokenType(TokenCategory category) {
        this.category = category;
    }

    public TokenCategory getCategory() {
        return category;
    }

    public boolean isKeyword() {
        return category == TokenCategory.KEYWORD;
    }
}
