package org.csu.symcalc.engine;

import org.csu.symcalc.compiler.lexer.Lexer;
import org.csu.symcalc.compiler.lexer.Token;
import org.csu.symcalc.compiler.parser.Parser;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;

import java.util.List;
import java.util.Map;

/**
 * 计算器核心的入口。
 * 串联 词法分析 -> 语法分析 -> 求导 / 化简 / 求值。没有状态，可以并发调用。
 */
public class SymbolicCalculator {

    public ExpressionNode parseExpression(String text) {
        Lexer lexer = new Lexer(text);
        List<Token> tokens = lexer.tokenize();
        Parser parser = new Parser(tokens);
        return parser.parse();
    }

    public ExpressionNode differentiate(ExpressionNode expression) {
        return Differentiator.differentiate(expression);
    }

    public ExpressionNode differentiate(ExpressionNode expression, String variable) {
        return Differentiator.differentiate(expression, variable);
    }

    public ExpressionNode simplify(ExpressionNode expression) {
        return Simplifier.simplify(expression);
    }

    public double evaluate(ExpressionNode expression, Map<String, Double> bindings) {
        return ExpressionEvaluator.evaluate(expression, bindings);
    }

    public String toDisplayString(ExpressionNode expression) {
        return ExpressionFormatter.toDisplayString(expression);
    }

    /**
     * 解析、求导并化简，返回导数的显示字符串。
     */
    public String parseAndDifferentiate(String text, String variable) {
        ExpressionNode tree = parseExpression(text);
        ExpressionNode derivative = differentiate(tree, variable);
        return toDisplayString(simplify(derivative));
    }

    public double evaluateExpression(String text, Map<String, Double> bindings) {
        return evaluate(parseExpression(text), bindings);
    }
}
