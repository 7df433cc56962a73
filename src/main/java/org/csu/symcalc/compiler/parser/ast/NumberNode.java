package org.csu.symcalc.compiler.parser.ast;

import org.csu.symcalc.engine.ExpressionFormatter;

/**
 * AST 节点: 表示一个数字常量
 */
public record NumberNode(double value) implements ExpressionNode {

    public static final NumberNode ZERO = new NumberNode(0);
    public static final NumberNode ONE = new NumberNode(1);

    public boolean is(double other) {
        return value == other;
    }

    // 按数值比较: 0.0 与 -0.0 相等
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return value == ((NumberNode) o).value;
    }

    @Override
    public int hashCode() {
        return value == 0 ? 0 : Double.hashCode(value);
    }

    @Override
    public String toString() {
        return ExpressionFormatter.toDisplayString(this);
    }
}
