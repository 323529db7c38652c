package org.csu.reldb.compiler;

import org.csu.reldb.common.exception.ParseException;
import org.csu.reldb.compiler.lexer.Lexer;
import org.csu.reldb.compiler.lexer.Token;
import org.csu.reldb.compiler.lexer.TokenCategory;
import org.csu.reldb.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 类的单元测试
 */
public class LexerTest {

    private List<Token> tokenize(String sql) {
        return new Lexer(sql).tokenize();
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        assertEquals(expectedTypes.length, tokens.size(), "Token数量不匹配: " + tokens);
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals(expectedTypes[i], tokens.get(i).type(), "Token类型不匹配 at index " + i);
        }
    }

    @Test
    void testSimpleSelectStatement() {
        List<Token> tokens = tokenize("SELECT id, name FROM student;");
        assertTypes(tokens,
                TokenType.SELECT, TokenType.IDENTIFIER, TokenType.COMMA, TokenType.IDENTIFIER,
                TokenType.FROM, TokenType.IDENTIFIER, TokenType.SEMICOLON, TokenType.EOF);
        assertEquals("id", tokens.get(1).lexeme());
        assertEquals("student", tokens.get(5).lexeme());
    }

    @Test
    void testKeywordsAreCaseInsensitiveAndUpperCased() {
        List<Token> tokens = tokenize("select Name from Users where AGE >= 18");
        assertEquals(TokenType.SELECT, tokens.get(0).type());
        assertEquals("SELECT", tokens.get(0).lexeme());
        assertEquals(TokenCategory.KEYWORD, tokens.get(0).category());
        // 标识符保持原样
        assertEquals("Name", tokens.get(1).lexeme());
        assertEquals("Users", tokens.get(3).lexeme());
        assertEquals(TokenType.WHERE, tokens.get(4).type());
        assertEquals(TokenType.GREATER_EQUAL, tokens.get(6).type());
    }

    @Test
    void testInsertWithAllLiteralKinds() {
        List<Token> tokens = tokenize("INSERT INTO t VALUES (101, -3.5, 'Alice', TRUE, NULL);");
        assertTypes(tokens,
                TokenType.INSERT, TokenType.INTO, TokenType.IDENTIFIER, TokenType.VALUES, TokenType.LPAREN,
                TokenType.INTEGER_CONST, TokenType.COMMA, TokenType.DECIMAL_CONST, TokenType.COMMA,
                TokenType.STRING_CONST, TokenType.COMMA, TokenType.TRUE, TokenType.COMMA, TokenType.NULL,
                TokenType.RPAREN, TokenType.SEMICOLON, TokenType.EOF);
        assertEquals("101", tokens.get(5).lexeme());
        assertEquals("-3.5", tokens.get(7).lexeme());
        assertEquals("Alice", tokens.get(9).lexeme());
    }

    @Test
    void testOperators() {
        List<Token> tokens = tokenize("= != <> < <= > >=");
        assertTypes(tokens,
                TokenType.EQUAL, TokenType.NOT_EQUAL, TokenType.NOT_EQUAL, TokenType.LESS,
                TokenType.LESS_EQUAL, TokenType.GREATER, TokenType.GREATER_EQUAL, TokenType.EOF);
        assertEquals(TokenCategory.OPERATOR, tokens.get(0).category());
    }

    @Test
    void testQualifiedNameAndAsterisk() {
        List<Token> tokens = tokenize("SELECT users.name, * FROM users");
        assertTypes(tokens,
                TokenType.SELECT, TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.COMMA,
                TokenType.ASTERISK, TokenType.FROM, TokenType.IDENTIFIER, TokenType.EOF);
    }

    @Test
    void testStringEscapesAndDoubleQuotes() {
        List<Token> tokens = tokenize("'it\\'s' \"say \\\"hi\\\"\"");
        assertEquals("it's", tokens.get(0).lexeme());
        assertEquals("say \"hi\"", tokens.get(1).lexeme());
        assertEquals(TokenCategory.STRING, tokens.get(1).category());
    }

    @Test
    void testMinusBeforeNonDigitIsRejected() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("SELECT - FROM t"));
        assertTrue(e.getMessage().contains("Unexpected character '-'"), e.getMessage());
    }

    @Test
    void testLineCommentsAreSkipped() {
        List<Token> tokens = tokenize("-- leading comment\nSELECT * FROM t -- trailing");
        assertTypes(tokens, TokenType.SELECT, TokenType.ASTERISK, TokenType.FROM, TokenType.IDENTIFIER, TokenType.EOF);
        assertEquals(2, tokens.get(0).line());
        assertEquals(1, tokens.get(0).column());
    }

    @Test
    void testPositionsAreTracked() {
        List<Token> tokens = tokenize("SELECT a\n  FROM t");
        assertEquals(1, tokens.get(1).line());
        assertEquals(8, tokens.get(1).column());
        assertEquals(2, tokens.get(2).line());
        assertEquals(3, tokens.get(2).column());
    }

    @Test
    void testIllegalCharacter() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("SELECT id FROM users WHERE id = #1"));
        assertEquals("Unexpected character '#' at line 1, column 33", e.getMessage());
    }

    @Test
    void testUnterminatedString() {
        ParseException e = assertThrows(ParseException.class, () -> tokenize("SELECT 'abc"));
        assertTrue(e.getMessage().startsWith("Unterminated string literal"), e.getMessage());
    }

    @Test
    void testSecondDotEndsNumber() {
        List<Token> tokens = tokenize("1.2.3");
        assertTypes(tokens, TokenType.DECIMAL_CONST, TokenType.DOT, TokenType.INTEGER_CONST, TokenType.EOF);
        assertEquals("1.2", tokens.get(0).lexeme());
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        assertTypes(tokenize("   \n\t "), TokenType.EOF);
    }
}
