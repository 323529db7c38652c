package org.csu.reldb.compiler.lexer;

import org.csu.reldb.common.exception.ParseException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的SQL字符串分解为一系列的Token，以 EOF 结尾。
 */
public class Lexer {

    private final String input;
    private int position = 0; // 当前读取的位置
    private int line = 1;     // 当前行号
    private int column = 1;   // 当前列号

    // 关键字映射表，键为小写
    private static final Map<String, TokenType> keywords = new HashMap<>();

    static {
        for (TokenType type : TokenType.values()) {
            if (type.isKeyword()) {
                keywords.put(type.name().toLowerCase(), type);
            }
        }
    }

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     * @throws ParseException 遇到无法识别的字符或未闭合的字符串时
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = nextToken();
            tokens.add(token);
        } while (token.type() != TokenType.EOF);
        return tokens;
    }

    private Token nextToken() {
        skipWhitespaceAndComments();

        if (position >= input.length()) {
            return new Token(TokenType.EOF, "", line, column);
        }

        char currentChar = peek();

        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // '-' 只有紧跟数字时才是负号
        if (isDigit(currentChar) || (currentChar == '-' && isDigit(peekNext()))) {
            return readNumber();
        }

        if (currentChar == '\'' || currentChar == '"') {
            return readString(currentChar);
        }

        // 识别运算符和分隔符
        switch (currentChar) {
            case '=':
                return consumeAndReturn(TokenType.EQUAL, "=");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ';':
                return consumeAndReturn(TokenType.SEMICOLON, ";");
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            case '*':
                return consumeAndReturn(TokenType.ASTERISK, "*");
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            case '>':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            case '<':
                if (peekNext() == '>') {
                    return consumeTwoAndReturn(TokenType.NOT_EQUAL, "<>");
                }
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '!':
                if (peekNext() == '=') {
                    return consumeTwoAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                // 单独的 '!' 交给语法分析器报错
                return consumeAndReturn(TokenType.BANG, "!");
            default:
                throw new ParseException(String.format("Unexpected character '%c' at line %d, column %d",
                        currentChar, line, column));
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 检查是否是关键字，忽略大小写；关键字文本统一为大写
        TokenType type = keywords.get(text.toLowerCase());
        if (type != null) {
            return new Token(type, text.toUpperCase(), line, startCol);
        }
        return new Token(TokenType.IDENTIFIER, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        if (peek() == '-') {
            advance();
        }
        boolean seenDot = false;
        while (position < input.length()) {
            char ch = peek();
            if (isDigit(ch)) {
                advance();
            } else if (ch == '.' && !seenDot) {
                seenDot = true;
                advance();
            } else {
                break;
            }
        }
        String number = input.substring(startPos, position);
        return new Token(seenDot ? TokenType.DECIMAL_CONST : TokenType.INTEGER_CONST, number, line, startCol);
    }

    private Token readString(char quote) {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始引号
        StringBuilder sb = new StringBuilder();
        while (position < input.length() && peek() != quote) {
            char ch = peek();
            if (ch == '\\' && position + 1 < input.length()) {
                advance();
                ch = peek();
            }
            if (ch == '\n') {
                line++;
                column = 0;
            }
            sb.append(ch);
            advance();
        }
        if (position >= input.length()) {
            throw new ParseException(String.format("Unterminated string literal starting at line %d, column %d",
                    startLine, startCol));
        }
        advance(); // 跳过结束引号
        return new Token(TokenType.STRING_CONST, sb.toString(), startLine, startCol);
    }

    // --- 辅助方法 ---

    private void skipWhitespaceAndComments() {
        while (position < input.length()) {
            char ch = peek();
            if (ch == ' ' || ch == '\t' || ch == '\r') {
                advance();
            } else if (ch == '\n') {
                line++;
                column = 0; // advance会加1，所以这里设为0
                advance();
            } else if (ch == '-' && peekNext() == '-') {
                // 行注释，跳到行尾
                while (position < input.length() && peek() != '\n') {
                    advance();
                }
            } else {
                break;
            }
        }
    }

    private char peek() {
        if (position >= input.length()) return '\0';
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        position++;
        column++;
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        return token;
    }

    private Token consumeTwoAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        advance();
        advance();
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
