package org.csu.symcalc.common.exception;

import lombok.Getter;
import org.csu.symcalc.compiler.lexer.Token;

/**
 * 语法分析阶段的异常，携带出错位置的 Token。
 */
@Getter
public class ParseException extends CalculatorException {

    private final Token token;

    public ParseException(Token token, String message) {
        super(message);
        this.token = token;
    }

    public static ParseException expected(Token token, String expected) {
        return new ParseException(token, String.format("Syntax Error at position %d: Expected %s, but found '%s' (%s)",
                token.position(),
                expected,
                token.lexeme(),
                token.type()));
    }
}
