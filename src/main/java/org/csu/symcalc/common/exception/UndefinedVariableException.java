package org.csu.symcalc.common.exception;

import lombok.Getter;

/**
 * 求值时变量没有绑定值。
 */
@Getter
public class UndefinedVariableException extends CalculatorException {

    private final String name;

    public UndefinedVariableException(String name) {
        super("Variable '" + name + "' not defined");
        this.name = name;
    }
}
