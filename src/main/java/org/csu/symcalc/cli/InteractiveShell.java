package org.csu.symcalc.cli;

import org.csu.symcalc.cli.tool.TreeVisualizer;
import org.csu.symcalc.common.exception.CalculatorException;
import org.csu.symcalc.compiler.lexer.Lexer;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.engine.Differentiator;
import org.csu.symcalc.engine.SymbolicCalculator;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 命令行计算器。
 * 不带参数时进入交互模式；带一个表达式参数时对它求导并尝试求值后退出。
 * 参数 --debug 打开 [DEBUG] 输出 (Token 流和表达式树)。
 */
public class InteractiveShell {

    private static final String PROMPT = "calc> ";
    private static final String DEBUG_FLAG = "--debug";

    private final SymbolicCalculator calculator;
    private final BufferedReader in;
    private final PrintStream out;
    private final Session session = new Session();

    public InteractiveShell(SymbolicCalculator calculator, BufferedReader in, PrintStream out) {
        this.calculator = calculator;
        this.in = in;
        this.out = out;
    }

    public static void main(String[] args) throws IOException {
        boolean debug = false;
        String expression = null;
        for (String arg : args) {
            if (arg.equals(DEBUG_FLAG)) {
                debug = true;
            } else if (expression == null) {
                expression = arg;
            } else {
                System.err.println("Usage: symcalc [--debug] [expression]");
                System.exit(2);
            }
        }

        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        InteractiveShell shell = new InteractiveShell(new SymbolicCalculator(), reader, System.out);
        shell.getSession().setDebug(debug);
        if (expression != null) {
            shell.runSingle(expression);
        } else {
            shell.run();
        }
    }

    public Session getSession() {
        return session;
    }

    /**
     * 交互模式主循环，读到 quit 或输入结束为止。
     */
    public void run() throws IOException {
        printBanner();
        while (true) {
            out.print(PROMPT);
            out.flush();
            String line = in.readLine();
            if (line == null) {
                out.println();
                break;
            }
            if (!handle(line.trim())) {
                break;
            }
        }
        out.println("Goodbye!");
    }

    /**
     * 单表达式模式: 对 x 求导，再尝试不带变量求值。
     */
    public void runSingle(String expression) {
        try {
            trace(expression);
            String derivative = calculator.parseAndDifferentiate(expression, Differentiator.DEFAULT_VARIABLE);
            out.println("d/dx(" + expression + ") = " + derivative);
        } catch (CalculatorException e) {
            out.println("ERROR: " + e.getMessage());
            return;
        }
        try {
            double value = calculator.evaluateExpression(expression, Map.of());
            out.println(expression + " = " + value);
        } catch (CalculatorException e) {
            out.println("Expression contains variables - use interactive mode to set values");
        }
    }

    /**
     * 处理一行输入。
     * @return false 表示用户要求退出
     */
    public boolean handle(String line) {
        if (line.isEmpty()) {
            return true;
        }
        String[] parts = line.split("\\s+", 2);
        String command = parts[0].toLowerCase(Locale.ROOT);
        String argument = parts.length > 1 ? parts[1].trim() : "";

        // 单词命令必须独占一行，"q + 1" 仍按表达式求值
        if (parts.length == 1) {
            switch (command) {
                case "quit":
                case "q":
                case "exit":
                    return false;
                case "help":
                case "h":
                    printHelp();
                    return true;
                case "clear":
                    session.clearVariables();
                    out.println("Variables cleared");
                    return true;
                case "vars":
                    printVariables();
                    return true;
                default:
                    break;
            }
        }

        try {
            switch (command) {
                case "set":
                    handleSet(argument);
                    break;
                case "diff":
                    handleDiff(argument);
                    break;
                case "eval":
                    handleEval(argument);
                    break;
                case "tree":
                    handleTree(argument);
                    break;
                default:
                    evaluateLine(line);
            }
        } catch (CalculatorException e) {
            out.println("ERROR: " + e.getMessage());
        }
        return true;
    }

    // 不是命令的输入按表达式求值，失败时提示 help
    private void evaluateLine(String line) {
        try {
            trace(line);
            double value = calculator.evaluateExpression(line, session.getVariables());
            out.println(line + " = " + value);
        } catch (CalculatorException e) {
            out.println("ERROR: " + e.getMessage());
            out.println("Try 'help' for available commands");
        }
    }

    private void handleSet(String argument) {
        String[] parts = argument.isEmpty() ? new String[0] : argument.split("\\s+");
        if (parts.length != 2) {
            out.println("Usage: set <variable> <value>");
            return;
        }
        try {
            double value = Double.parseDouble(parts[1]);
            session.setVariable(parts[0], value);
            out.println("Set " + parts[0] + " = " + value);
        } catch (NumberFormatException e) {
            out.println("ERROR: Invalid variable value '" + parts[1] + "'");
        }
    }

    private void handleDiff(String argument) {
        String expression = argument;
        String variable = Differentiator.DEFAULT_VARIABLE;
        int wrt = argument.indexOf(" wrt ");
        if (wrt >= 0) {
            expression = argument.substring(0, wrt).trim();
            variable = argument.substring(wrt + " wrt ".length()).trim();
        }
        trace(expression);
        String derivative = calculator.parseAndDifferentiate(expression, variable);
        out.println("d/d" + variable + "(" + expression + ") = " + derivative);
    }

    private void handleEval(String argument) {
        String expression = argument;
        Map<String, Double> bindings = session.getVariables();
        int at = argument.indexOf(" at ");
        if (at >= 0) {
            expression = argument.substring(0, at).trim();
            Map<String, Double> assigned = new HashMap<>();
            for (String assignment : argument.substring(at + " at ".length()).split(",")) {
                int eq = assignment.indexOf('=');
                if (eq < 0) {
                    continue;
                }
                String name = assignment.substring(0, eq).trim();
                String text = assignment.substring(eq + 1).trim();
                try {
                    assigned.put(name, Double.parseDouble(text));
                } catch (NumberFormatException e) {
                    out.println("ERROR: Invalid value for " + name);
                    return;
                }
            }
            // at 子句里没有任何 name=value 时仍使用会话变量
            if (!assigned.isEmpty()) {
                bindings = assigned;
            }
        }
        trace(expression);
        double value = calculator.evaluateExpression(expression, bindings);
        out.println(expression + " = " + value);
    }

    private void handleTree(String argument) {
        String expression = argument;
        boolean simple = false;
        if (argument.endsWith(" simple")) {
            expression = argument.substring(0, argument.length() - " simple".length()).trim();
            simple = true;
        }
        ExpressionNode tree = calculator.parseExpression(expression);
        out.println("Expression tree for '" + expression + "':");
        out.println(simple ? TreeVisualizer.visualizeSimple(tree) : TreeVisualizer.visualize(tree));
    }

    private void printVariables() {
        Map<String, Double> variables = session.getVariables();
        if (variables.isEmpty()) {
            out.println("No variables set");
            return;
        }
        out.println("Current variables:");
        variables.forEach((name, value) -> out.println("  " + name + " = " + value));
    }

    private void trace(String expression) {
        if (!session.isDebug()) {
            return;
        }
        try {
            out.println("[DEBUG] Tokens: " + new Lexer(expression).tokenize());
            out.println("[DEBUG] Tree: " + TreeVisualizer.visualizeSimple(calculator.parseExpression(expression)));
        } catch (CalculatorException e) {
            // 错误由正常流程报告
            out.println("[DEBUG] " + e.getClass().getSimpleName());
        }
    }

    private void printBanner() {
        out.println("=".repeat(60));
        out.println("Command-Line Calculator with Symbolic Differentiation");
        out.println("=".repeat(60));
        out.println("Supported operations: +, -, *, /, ^ (exponentiation)");
        out.println("Variables are single letters (x, y, z, ...)");
        out.println("Type 'help' for commands, 'quit' to exit");
        out.println("=".repeat(60));
    }

    private void printHelp() {
        out.println("Calculator Commands:");
        out.println("  help, h             - Show this help message");
        out.println("  quit, q, exit       - Exit the calculator");
        out.println("  clear               - Clear all variable values");
        out.println("  vars                - Show current variable values");
        out.println("  set <var> <val>     - Set variable value (e.g., 'set x 5')");
        out.println();
        out.println("Expression Commands:");
        out.println("  diff <expr>            - Differentiate expression with respect to x");
        out.println("  diff <expr> wrt <var>  - Differentiate with respect to variable");
        out.println("  eval <expr>            - Evaluate expression with the current variables");
        out.println("  eval <expr> at x=3,y=4 - Evaluate with specific values");
        out.println("  tree <expr>            - Show expression tree structure");
        out.println("  tree <expr> simple     - Show simple tree view");
        out.println("  <expr>                 - Evaluate expression");
    }
}
