package org.csu.symcalc.compiler.parser;

import org.csu.symcalc.common.exception.ParseException;
import org.csu.symcalc.compiler.lexer.Token;
import org.csu.symcalc.compiler.lexer.TokenType;
import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.Operator;
import org.csu.symcalc.compiler.parser.ast.VariableNode;

import java.util.List;

/**
 * 语法分析器
 * 采用递归下降法，将Token流转换为表达式树。
 * <pre>
 * expression := term (('+'|'-') term)*
 * term       := power (('*'|'/') power)*
 * power      := primary ('^' power)?      // 右结合
 * primary    := NUMBER | VARIABLE | '(' expression ')'
 * </pre>
 */
public class Parser {

    private final List<Token> tokens;
    private int position = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    public ExpressionNode parse() {
        if (tokens.isEmpty()) {
            throw new ParseException(null, "Syntax Error: No tokens to parse");
        }
        if (peek().type() == TokenType.EOF) {
            throw new ParseException(peek(), "Syntax Error: Empty expression");
        }

        ExpressionNode expression = parseExpression();

        if (!isAtEnd()) {
            throw ParseException.expected(peek(), "end of expression");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (match("+", "-")) {
            Operator operator = Operator.fromSymbol(previous().lexeme());
            ExpressionNode right = parseTerm();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parsePower();
        while (match("*", "/")) {
            Operator operator = Operator.fromSymbol(previous().lexeme());
            ExpressionNode right = parsePower();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parsePower() {
        ExpressionNode base = parsePrimary();
        if (match("^")) {
            // 递归自身实现右结合: 2^3^2 = 2^(3^2)
            ExpressionNode exponent = parsePower();
            return new BinaryExpressionNode(base, Operator.POWER, exponent);
        }
        return base;
    }

    private ExpressionNode parsePrimary() {
        if (match(TokenType.NUMBER)) {
            return new NumberNode(previous().value());
        }
        if (match(TokenType.VARIABLE)) {
            return new VariableNode(previous().lexeme());
        }
        if (match(TokenType.LPAREN)) {
            ExpressionNode expr = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            return expr;
        }
        throw ParseException.expected(peek(), "a number, a variable or '('");
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    // 匹配指定符号的 OPERATOR Token
    private boolean match(String... operators) {
        if (!check(TokenType.OPERATOR)) return false;
        for (String operator : operators) {
            if (peek().lexeme().equals(operator)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw ParseException.expected(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        if (position >= tokens.size()) {
            // 没有 EOF 哨兵的 Token 列表，按输入结束处理
            Token last = tokens.get(tokens.size() - 1);
            return Token.of(TokenType.EOF, "", last.position() + last.lexeme().length());
        }
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
