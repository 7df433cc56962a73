package org.csu.symcalc.common.exception;

public class DivisionByZeroException extends CalculatorException {

    public DivisionByZeroException() {
        super("Division by zero");
    }
}
