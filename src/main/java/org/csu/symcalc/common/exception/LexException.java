package org.csu.symcalc.common.exception;

import lombok.Getter;

/**
 * 词法分析阶段的异常：遇到非法字符或无法转换的数字字面量。
 */
@Getter
public class LexException extends CalculatorException {

    private final String text;  // 出错的字符或数字片段
    private final int position; // 在原始输入中的偏移量 (从0开始)

    public LexException(char character, int position) {
        super(String.format("Invalid character '%c' at position %d", character, position));
        this.text = String.valueOf(character);
        this.position = position;
    }

    public LexException(String number, int position, Throwable cause) {
        super(String.format("Invalid number '%s' at position %d", number, position));
        this.text = number;
        this.position = position;
        initCause(cause);
    }
}
