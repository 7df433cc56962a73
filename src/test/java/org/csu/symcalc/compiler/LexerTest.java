package org.csu.symcalc.compiler;

import org.csu.symcalc.common.exception.LexException;
import org.csu.symcalc.compiler.lexer.Lexer;
import org.csu.symcalc.compiler.lexer.Token;
import org.csu.symcalc.compiler.lexer.TokenType;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

/**
 * Lexer 类的单元测试 (使用 JUnit 4)
 */
public class LexerTest {

    private List<Token> tokenize(String input) {
        System.out.println("Input: " + input); // [日志] 打印输入
        List<Token> tokens = new Lexer(input).tokenize();
        System.out.println("Generated Tokens: " + tokens);
        return tokens;
    }

    private void assertTypes(List<Token> tokens, TokenType... expectedTypes) {
        assertEquals("Token数量不匹配", expectedTypes.length, tokens.size());
        for (int i = 0; i < expectedTypes.length; i++) {
            assertEquals("Token类型不匹配 at index " + i, expectedTypes[i], tokens.get(i).type());
        }
    }

    @Test
    public void testSimpleExpression() {
        System.out.println("--- Running test: testSimpleExpression ---");
        List<Token> tokens = tokenize("2*x + 3");

        assertTypes(tokens, TokenType.NUMBER, TokenType.OPERATOR, TokenType.VARIABLE,
                TokenType.OPERATOR, TokenType.NUMBER, TokenType.EOF);
        assertEquals(2.0, tokens.get(0).value(), 0.0);
        assertEquals("*", tokens.get(1).lexeme());
        assertEquals("x", tokens.get(2).lexeme());
        assertEquals("+", tokens.get(3).lexeme());
        assertEquals(3.0, tokens.get(4).value(), 0.0);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testParenthesesAndPositions() {
        List<Token> tokens = tokenize("(x + 1)^2");

        assertTypes(tokens, TokenType.LPAREN, TokenType.VARIABLE, TokenType.OPERATOR, TokenType.NUMBER,
                TokenType.RPAREN, TokenType.OPERATOR, TokenType.NUMBER, TokenType.EOF);
        assertEquals(0, tokens.get(0).position());
        assertEquals(1, tokens.get(1).position());
        assertEquals(3, tokens.get(2).position());
        assertEquals(5, tokens.get(3).position());
        assertEquals(6, tokens.get(4).position());
        assertEquals(9, tokens.get(7).position());
    }

    @Test
    public void testDecimalNumbers() {
        List<Token> tokens = tokenize("3.14 .5 2.");

        assertTypes(tokens, TokenType.NUMBER, TokenType.NUMBER, TokenType.NUMBER, TokenType.EOF);
        assertEquals(3.14, tokens.get(0).value(), 0.0);
        assertEquals(0.5, tokens.get(1).value(), 0.0);
        assertEquals(2.0, tokens.get(2).value(), 0.0);
        assertEquals("3.14", tokens.get(0).lexeme());
    }

    @Test
    public void testAdjacentLettersAreSeparateVariables() {
        List<Token> tokens = tokenize("xy");

        // 没有隐含乘法
        assertTypes(tokens, TokenType.VARIABLE, TokenType.VARIABLE, TokenType.EOF);
        assertEquals("x", tokens.get(0).lexeme());
        assertEquals("y", tokens.get(1).lexeme());
    }

    @Test
    public void testMinusIsAlwaysAnOperator() {
        List<Token> tokens = tokenize("-2");

        assertTypes(tokens, TokenType.OPERATOR, TokenType.NUMBER, TokenType.EOF);
        assertEquals("-", tokens.get(0).lexeme());
        assertEquals(2.0, tokens.get(1).value(), 0.0);
    }

    @Test
    public void testEmptyInputOnlyHasEof() {
        assertTypes(tokenize(""), TokenType.EOF);
        assertTypes(tokenize("   "), TokenType.EOF);
    }

    @Test
    public void testIllegalCharacter() {
        System.out.println("--- Running test: testIllegalCharacter ---");
        LexException e = assertThrows(LexException.class, () -> tokenize("2 & 3"));

        assertEquals("&", e.getText());
        assertEquals(2, e.getPosition());
        assertEquals("Invalid character '&' at position 2", e.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    public void testMalformedNumber() {
        LexException e = assertThrows(LexException.class, () -> tokenize("x + 1.2.3"));

        assertEquals("1.2.3", e.getText());
        assertEquals(4, e.getPosition());
        assertTrue(e.getMessage().contains("Invalid number '1.2.3'"));
        assertTrue(e.getCause() instanceof NumberFormatException);
    }

    @Test
    public void testLoneDecimalPoint() {
        assertThrows(LexException.class, () -> tokenize("."));
    }
}
