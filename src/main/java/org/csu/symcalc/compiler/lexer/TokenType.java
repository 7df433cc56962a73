package org.csu.symcalc.compiler.lexer;

/**
 * 定义词法单元（Token）的类型，即“种别码”
 */
public enum TokenType {
    NUMBER,     // 数字常量, e.g., 2, 3.14
    VARIABLE,   // 单字母变量, e.g., x
    OPERATOR,   // + - * / ^
    LPAREN,     // (
    RPAREN,     // )

    // ---- 特殊 Token ----
    EOF         // 输入结束，总是最后一个 Token
}
