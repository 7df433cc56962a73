package org.csu.symcalc.common.exception;

/**
 * 计算器核心所有错误的公共父类。
 * 消息文本可以直接展示给用户。
 */
public class CalculatorException extends RuntimeException {

    public CalculatorException(String message) {
        super(message);
    }
}
