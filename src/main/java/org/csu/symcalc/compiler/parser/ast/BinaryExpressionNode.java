package org.csu.symcalc.compiler.parser.ast;

import org.csu.symcalc.engine.ExpressionFormatter;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., x + 1)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        Operator operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public String toString() {
        return ExpressionFormatter.toDisplayString(this);
    }
}
