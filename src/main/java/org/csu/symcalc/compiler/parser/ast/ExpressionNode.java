package org.csu.symcalc.compiler.parser.ast;

/**
 * 所有表达式AST节点的标记接口。
 * 只有三种节点：数字、变量、二元运算。节点不可变，所有变换都返回新的树。
 */
public sealed interface ExpressionNode permits NumberNode, VariableNode, BinaryExpressionNode {
}
