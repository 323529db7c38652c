package org.csu.reldb.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的文本，关键字统一为大写，字符串为去掉引号和转义后的内容
 * @param line 所在的行号
 * @param column 所在的列号
 */
public record Token(TokenType type, String lexeme, int line, int column) {

    public TokenCategory category() {
        return type.getCategory();
    }

    @Override
    public String toString() {
        return String.format("Token[Type=%-15s, Lexeme='%s', Position=%d:%d]",
                type, lexeme, line, column);
    }
}
