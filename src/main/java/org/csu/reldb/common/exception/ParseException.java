package org.csu.reldb.common.exception;

import org.csu.reldb.compiler.lexer.Token;
import org.csu.reldb.compiler.lexer.TokenType;

/**
 * 词法或语法错误。
 */
public class ParseException extends DatabaseException {

    public ParseException(String message) {
        super(message);
    }

    public ParseException(Token token, String expected) {
        super(token.type() == TokenType.EOF
                ? String.format("Syntax error at line %d, column %d: Expected %s, but found end of input",
                        token.line(), token.column(), expected)
                : String.format("Syntax error at line %d, column %d: Expected %s, but found '%s'",
                        token.line(), token.column(), expected, token.lexeme()));
    }
}
