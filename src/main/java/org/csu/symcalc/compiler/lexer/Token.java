package org.csu.symcalc.compiler.lexer;

/**
 * @param type 词法单元的类型 (种别码)
 * @param lexeme 词法单元的原始文本 (词素值)
 * @param value 数字常量的值，其他类型为 0
 * @param position 在输入中的偏移量 (从0开始)
 */
public record Token(TokenType type, String lexeme, double value, int position) {

    public static Token of(TokenType type, String lexeme, int position) {
        return new Token(type, lexeme, 0, position);
    }

    public static Token number(String lexeme, double value, int position) {
        return new Token(TokenType.NUMBER, lexeme, value, position);
    }

    @Override
    public String toString() {
        if (type == TokenType.NUMBER) {
            return type + "(" + value + ")";
        }
        if (type == TokenType.VARIABLE || type == TokenType.OPERATOR) {
            return type + "(" + lexeme + ")";
        }
        return type.name();
    }
}
