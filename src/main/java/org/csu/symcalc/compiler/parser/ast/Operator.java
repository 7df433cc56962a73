package org.csu.symcalc.compiler.parser.ast;

/**
 * 支持的五种二元运算符
 */
public enum Operator {
    PLUS('+'),
    MINUS('-'),
    MULTIPLY('*'),
    DIVIDE('/'),
    POWER('^');

    private final char symbol;

    Operator(char symbol) {
        this.symbol = symbol;
    }

    public static Operator fromSymbol(String symbol) {
        for (Operator operator : values()) {
            if (symbol.length() == 1 && operator.symbol == symbol.charAt(0)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown operator: " + symbol);
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
