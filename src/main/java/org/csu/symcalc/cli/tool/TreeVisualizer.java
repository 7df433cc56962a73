package org.csu.symcalc.cli.tool;

import org.csu.symcalc.compiler.parser.ast.BinaryExpressionNode;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.csu.symcalc.compiler.parser.ast.VariableNode;
import org.csu.symcalc.engine.ExpressionFormatter;


import java.util.ArrayList;
import java.util.List;

/**
 * 一个可重用的工具类，用于把表达式树画成控制台里的 ASCII 树形图。
 * <pre>
 *      '+'
 *   ┌───────┐
 * Variable(x) Number(1.0)
 * </pre>
 */
public class TreeVisualizer {

    public static final int DEFAULT_WIDTH = 80;

    public static String visualize(ExpressionNode node) {
        return visualize(node, true, DEFAULT_WIDTH);
    }

    /**
     * @param node       要绘制的表达式树
     * @param showValues 为 false 时只显示节点类型，不显示值和运算符
     * @param maxWidth   整棵树不超过该宽度时，每一行居中到该宽度
     * @return 多行字符串
     */
    public static String visualize(ExpressionNode node, boolean showValues, int maxWidth) {
        List<String> lines = buildLines(node, showValues);
        int width = lines.stream().mapToInt(String::length).max().orElse(0);
        List<String> result = new ArrayList<>();
        for (String line : lines) {
            String out = width <= maxWidth ? center(line, maxWidth) : line;
            result.add(out.stripTrailing());
        }
        return String.join("\n", result);
    }

    /**
     * 全括号的单行形式，例如 ((x + 1.0) ^ 2.0)
     */
    public static String visualizeSimple(ExpressionNode node) {
        if (node instanceof NumberNode number) {
            return ExpressionFormatter.formatNumber(number.value());
        }
        if (node instanceof VariableNode variable) {
            return variable.name();
        }
        if (node instanceof BinaryExpressionNode binary) {
            return "(" + visualizeSimple(binary.left()) + " " + binary.operator() + " " + visualizeSimple(binary.right()) + ")";
        }
        throw new IllegalStateException("Unsupported expression type: " + node.getClass().getSimpleName());
    }

    // 返回的每一行宽度相同
    private static List<String> buildLines(ExpressionNode node, boolean showValues) {
        if (node instanceof NumberNode number) {
            return List.of(showValues ? "Number(" + ExpressionFormatter.formatNumber(number.value()) + ")" : "Number");
        }
        if (node instanceof VariableNode variable) {
            return List.of(showValues ? "Variable(" + variable.name() + ")" : "Variable");
        }
        if (node instanceof BinaryExpressionNode binary) {
            List<String> left = buildLines(binary.left(), showValues);
            List<String> right = buildLines(binary.right(), showValues);
            String operator = showValues ? "'" + binary.operator() + "'" : "Op";
            return combine(left, operator, right);
        }
        throw new IllegalStateException("Unsupported expression type: " + node.getClass().getSimpleName());
    }

    private static List<String> combine(List<String> left, String operator, List<String> right) {
        int leftWidth = left.get(0).length();
        int rightWidth = right.get(0).length();
        int width = Math.max(leftWidth + 1 + rightWidth, operator.length());
        int height = Math.max(left.size(), right.size());

        List<String> result = new ArrayList<>();
        result.add(padRight(center(operator, width), width));

        // 连接线从左子树中点画到右子树中点
        int from = leftWidth / 2;
        int to = leftWidth + 1 + rightWidth / 2;
        StringBuilder connector = new StringBuilder(" ".repeat(from)).append('┌');
        connector.append("─".repeat(Math.max(0, to - from - 1))).append('┐');
        result.add(padRight(connector.toString(), width));

        for (int i = 0; i < height; i++) {
            String l = i < left.size() ? left.get(i) : " ".repeat(leftWidth);
            String r = i < right.size() ? right.get(i) : " ".repeat(rightWidth);
            result.add(padRight(l + " " + r, width));
        }
        return result;
    }

    private static String center(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        int leftPadding = (width - text.length()) / 2;
        return " ".repeat(leftPadding) + text;
    }

    private static String padRight(String text, int width) {
        return text.length() >= width ? text : text + " ".repeat(width - text.length());
    }
}
