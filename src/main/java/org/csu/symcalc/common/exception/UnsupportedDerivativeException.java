package org.csu.symcalc.common.exception;

/**
 * 求导时遇到非常数指数 (f^g)。
 */
public class UnsupportedDerivativeException extends CalculatorException {

    public UnsupportedDerivativeException() {
        super("derivative of a variable exponent requires logarithmic differentiation, not implemented");
    }
}
