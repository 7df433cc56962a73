package org.csu.symcalc.engine;

import org.csu.symcalc.common.exception.DivisionByZeroException;
import org.csu.symcalc.common.exception.UndefinedVariableException;
import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.VariableNode;

import java.util.Map;

/**
 * 表达式求值器。
 * 在给定的变量绑定下计算表达式树的数值。
 */
public class ExpressionEvaluator {

    /**
     * @param expression 表达式树
     * @param bindings   变量名到值的映射，可以为 null (视为空)
     * @throws UndefinedVariableException 变量没有绑定
     * @throws DivisionByZeroException    除数恰好为 0
     */
    public static double evaluate(ExpressionNode expression, Map<String, Double> bindings) {
        if (expression instanceof NumberNode number) {
            return number.value();
        }
        if (expression instanceof VariableNode variable) {
            Double value = bindings == null ? null : bindings.get(variable.name());
            if (value == null) {
                throw new UndefinedVariableException(variable.name());
            }
            return value;
        }
        if (expression instanceof BinaryExpressionNode node) {
            double left = evaluate(node.left(), bindings);
            double right = evaluate(node.right(), bindings);
            return switch (node.operator()) {
                case PLUS -> left + right;
                case MINUS -> left - right;
                case MULTIPLY -> left * right;
                case DIVIDE -> {
                    if (right == 0) {
                        throw new DivisionByZeroException();
                    }
                    yield left / right;
                }
                case POWER -> Math.pow(left, right);
            };
        }
        throw new IllegalStateException("Unsupported expression type for evaluation: " + expression.getClass().getSimpleName());
    }
}
