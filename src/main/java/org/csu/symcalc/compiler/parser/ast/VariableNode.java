package org.csu.symcalc.compiler.parser.ast;

import org.csu.symcalc.engine.ExpressionFormatter;

/**
 * AST 节点: 表示一个未绑定的单字母变量
 */
public record VariableNode(String name) implements ExpressionNode {

    @Override
    public String toString() {
        return ExpressionFormatter.toDisplayString(this);
    }
}
