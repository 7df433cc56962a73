package org.csu.symcalc.engine;

import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.VariableNode;

import java.math.BigDecimal;

/**
 * 将表达式树格式化为中缀字符串。
 * 只要子节点本身是二元运算就加括号，不考虑优先级，例如 (x + 1.0) * x。
 */
public class ExpressionFormatter {

    public static String toDisplayString(ExpressionNode expression) {
        if (expression instanceof NumberNode number) {
            return formatNumber(number.value());
        }
        if (expression instanceof VariableNode variable) {
            return variable.name();
        }
        if (expression instanceof BinaryExpressionNode node) {
            return operand(node.left()) + " " + node.operator() + " " + operand(node.right());
        }
        throw new IllegalStateException("Unsupported expression type: " + expression.getClass().getSimpleName());
    }

    /**
     * 数字一律写成不带指数的小数形式 (12345678.0, 0.0001)，保证词法分析器能读回。
     * NaN 和 Infinity 只会由常量折叠产生，按 Java 的写法原样输出。
     */
    public static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return String.valueOf(value);
        }
        String plain = BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }

    private static String operand(ExpressionNode child) {
        String text = toDisplayString(child);
        return child instanceof BinaryExpressionNode ? "(" + text + ")" : text;
    }
}
