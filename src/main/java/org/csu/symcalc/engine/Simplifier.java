package org.csu.symcalc.engine;

import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.Operator;

/**
 * 表达式化简器。
 * <p>
 * 自底向上只做一遍: 先化简左右子树，再对当前节点按顺序尝试规则，命中第一条即返回。
 * 改写后的节点不会再被化简一次，所以有些表达式不能一次化到最简，这是已知的限制。
 * 除以零不在这里检查，常量折叠得到的是 IEEE 结果 (Infinity/NaN)。
 */
public class Simplifier {

    public static ExpressionNode simplify(ExpressionNode expression) {
        if (expression instanceof BinaryExpressionNode node) {
            ExpressionNode left = simplify(node.left());
            ExpressionNode right = simplify(node.right());
            return simplifyBinary(left, node.operator(), right);
        }
        // 数字和变量本身已经是最简
        return expression;
    }

    private static ExpressionNode simplifyBinary(ExpressionNode left, Operator operator, ExpressionNode right) {
        switch (operator) {
            case PLUS:
                if (isNumber(right, 0)) return left;
                if (isNumber(left, 0)) return right;
                if (left instanceof NumberNode a && right instanceof NumberNode b) {
                    return new NumberNode(a.value() + b.value());
                }
                break;
            case MINUS:
                if (isNumber(right, 0)) return left;
                // 没有一元负号，0 - x 保留原样 (先于常量折叠，0 - 5 也保留)
                if (isNumber(left, 0)) return new BinaryExpressionNode(NumberNode.ZERO, Operator.MINUS, right);
                if (left instanceof NumberNode a && right instanceof NumberNode b) {
                    return new NumberNode(a.value() - b.value());
                }
                break;
            case MULTIPLY:
                if (isNumber(left, 0) || isNumber(right, 0)) return NumberNode.ZERO;
                if (isNumber(right, 1)) return left;
                if (isNumber(left, 1)) return right;
                if (left instanceof NumberNode a && right instanceof NumberNode b) {
                    return new NumberNode(a.value() * b.value());
                }
                break;
            case DIVIDE:
                if (isNumber(right, 1)) return left;
                if (isNumber(left, 0)) return NumberNode.ZERO;
                if (left instanceof NumberNode a && right instanceof NumberNode b) {
                    return new NumberNode(a.value() / b.value());
                }
                break;
            case POWER:
                if (isNumber(right, 1)) return left;
                // 0^0 同样得到 1
                if (isNumber(right, 0)) return NumberNode.ONE;
                if (left instanceof NumberNode a && right instanceof NumberNode b) {
                    return new NumberNode(Math.pow(a.value(), b.value()));
                }
                break;
            default:
                throw new IllegalStateException("Unknown operator: " + operator);
        }
        return new BinaryExpressionNode(left, operator, right);
    }

    private static boolean isNumber(ExpressionNode node, double value) {
        return node instanceof NumberNode number && number.is(value);
    }
}
