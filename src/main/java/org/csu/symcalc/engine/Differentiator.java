package org.csu.symcalc.engine;

import org.csu.symcalc.common.exception.UnsupportedDerivativeException;
import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.Operator;
import org.csu.symcalc.compiler.parser.ast.VariableNode;

/**
 * 符号求导。
 * 按结构递归应用求导法则，结果没有化简，需要再交给 {@link Simplifier}。
 */
public class Differentiator {

    public static final String DEFAULT_VARIABLE = "x";

    public static ExpressionNode differentiate(ExpressionNode expression) {
        return differentiate(expression, DEFAULT_VARIABLE);
    }

    /**
     * @param expression 被求导的表达式
     * @param variable   求导变量
     * @return 新的导数表达式树
     * @throws UnsupportedDerivativeException 指数不是数字常量
     */
    public static ExpressionNode differentiate(ExpressionNode expression, String variable) {
        if (expression instanceof NumberNode) {
            return NumberNode.ZERO;
        }
        if (expression instanceof VariableNode v) {
            return v.name().equals(variable) ? NumberNode.ONE : NumberNode.ZERO;
        }
        if (expression instanceof BinaryExpressionNode node) {
            return differentiateBinary(node, variable);
        }
        throw new IllegalStateException("Unsupported expression type for differentiation: " + expression.getClass().getSimpleName());
    }

    private static ExpressionNode differentiateBinary(BinaryExpressionNode node, String variable) {
        ExpressionNode f = node.left();
        ExpressionNode g = node.right();
        switch (node.operator()) {
            case PLUS:
            case MINUS:
                return new BinaryExpressionNode(differentiate(f, variable), node.operator(), differentiate(g, variable));
            case MULTIPLY:
                // f'g + fg'
                return new BinaryExpressionNode(
                        new BinaryExpressionNode(differentiate(f, variable), Operator.MULTIPLY, g),
                        Operator.PLUS,
                        new BinaryExpressionNode(f, Operator.MULTIPLY, differentiate(g, variable)));
            case DIVIDE: {
                // (f'g - fg') / g^2
                ExpressionNode numerator = new BinaryExpressionNode(
                        new BinaryExpressionNode(differentiate(f, variable), Operator.MULTIPLY, g),
                        Operator.MINUS,
                        new BinaryExpressionNode(f, Operator.MULTIPLY, differentiate(g, variable)));
                ExpressionNode denominator = new BinaryExpressionNode(g, Operator.POWER, new NumberNode(2));
                return new BinaryExpressionNode(numerator, Operator.DIVIDE, denominator);
            }
            case POWER:
                return differentiatePower(f, g, variable);
            default:
                throw new IllegalStateException("Unknown operator: " + node.operator());
        }
    }

    private static ExpressionNode differentiatePower(ExpressionNode base, ExpressionNode exponent, String variable) {
        if (!(exponent instanceof NumberNode constant)) {
            throw new UnsupportedDerivativeException();
        }
        double n = constant.value();
        if (n == 1) {
            return differentiate(base, variable);
        }
        if (n == 0) {
            return NumberNode.ZERO;
        }
        // n * f^(n-1) * f'
        ExpressionNode power = new BinaryExpressionNode(base, Operator.POWER, new NumberNode(n - 1));
        ExpressionNode coefficient = new BinaryExpressionNode(new NumberNode(n), Operator.MULTIPLY, power);
        return new BinaryExpressionNode(coefficient, Operator.MULTIPLY, differentiate(base, variable));
    }
}
