package org.csu.symcalc.compiler.lexer;

import org.csu.symcalc.common.exception.LexException;

import java.util.ArrayList;
import java.util.List;

/**
 * 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的表达式字符串分解为一系列的Token。
 * 变量只支持单个字母，"xy" 会得到两个独立的变量 Token，不会隐含乘法。
 * '-' 总是作为减法运算符输出，数字扫描只从数字或小数点开始，因此没有一元负号。
 */
public class Lexer {

    private static final String OPERATORS = "+-*/^";

    private final String input;
    private int position = 0; // 当前读取的位置

    public Lexer(String input) {
        this.input = input;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，最后一个总是 EOF
     * @throws LexException 遇到非法字符或非法数字
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
        skipWhitespace();

        if (position >= input.length()) {
            return Token.of(TokenType.EOF, "", position);
        }

        char currentChar = peek();

        if (isDigit(currentChar) || currentChar == '.') {
            return readNumber();
        }

        // 只消耗一个字母
        if (Character.isLetter(currentChar)) {
            return consumeAndReturn(TokenType.VARIABLE, String.valueOf(currentChar));
        }

        if (OPERATORS.indexOf(currentChar) >= 0) {
            return consumeAndReturn(TokenType.OPERATOR, String.valueOf(currentChar));
        }

        switch (currentChar) {
            case '(':
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                return consumeAndReturn(TokenType.RPAREN, ")");
            default:
                throw new LexException(currentChar, position);
        }
    }

    private Token readNumber() {
        int startPos = position;
        // 贪婪读取数字和小数点，不检查小数点个数，"1.2.3" 留给 parseDouble 报错
        while (position < input.length() && (isDigit(peek()) || peek() == '.')) {
            position++;
        }
        String number = input.substring(startPos, position);
        try {
            return Token.number(number, Double.parseDouble(number), startPos);
        } catch (NumberFormatException e) {
            throw new LexException(number, startPos, e);
        }
    }

    // --- 辅助方法 ---

    private void skipWhitespace() {
        while (position < input.length() && Character.isWhitespace(peek())) {
            position++;
        }
    }

    private char peek() {
        return input.charAt(position);
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = Token.of(type, lexeme, position);
        position++;
        return token;
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
