package org.csu.symcalc.engine;

import org.csu.symcalc.common.exception.DivisionByZeroException;
import org.csu.symcalc.common.exception.LexException;
import org.csu.symcalc.common.exception.ParseException;
import org.csu.symcalc.common.exception.UndefinedVariableException;
import org.csu.symcalc.compiler.parser.ast.ExpressionNode;
import org.csu.symcalc.compiler.parser.ast.NumberNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 整条流水线 (解析 -> 求导 -> 化简 -> 求值) 的集成测试。
 */
public class SymbolicCalculatorTest {

    private SymbolicCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new SymbolicCalculator();
    }

    @Test
    void testDerivativeValues() {
        System.out.println("--- Test: Derivative values ---");
        ExpressionNode square = calculator.differentiate(calculator.parseExpression("x^2"), "x");
        assertEquals(6.0, calculator.evaluate(square, Map.of("x", 3.0)));

        ExpressionNode product = calculator.differentiate(calculator.parseExpression("(x+1)*(x-1)"));
        assertEquals(10.0, calculator.evaluate(product, Map.of("x", 5.0)));
    }

    @Test
    void testParseAndDifferentiate() {
        assertEquals("2.0", calculator.parseAndDifferentiate("2*x + 3", "x"));
        assertEquals("2.0 * x", calculator.parseAndDifferentiate("x^2", "x"));
        assertEquals("0.0", calculator.parseAndDifferentiate("x^2", "y"));
        assertEquals("x ^ 2.0", calculator.parseAndDifferentiate("x^2*y", "y"));
    }

    @Test
    void testEvaluateExpression() {
        assertEquals(26.0, calculator.evaluateExpression("2*3 + 4*5", Map.of()));
        assertEquals(512.0, calculator.evaluateExpression("2^3^2", Map.of()));
        assertEquals(25.0, calculator.evaluateExpression("x^2 + y^2", Map.of("x", 3.0, "y", 4.0)));
    }

    @Test
    void testErrorsSurfaceUnchanged() {
        LexException lex = assertThrows(LexException.class, () -> calculator.parseExpression("2 & 3"));
        assertTrue(lex.getMessage().contains("'&'"));

        ParseException parse = assertThrows(ParseException.class, () -> calculator.parseExpression("(x + 1"));
        assertTrue(parse.getMessage().contains("')'"));

        assertThrows(DivisionByZeroException.class,
                () -> calculator.evaluate(calculator.parseExpression("x/0"), Map.of("x", 1.0)));

        UndefinedVariableException undefined = assertThrows(UndefinedVariableException.class,
                () -> calculator.evaluate(calculator.parseExpression("y"), Map.of()));
        assertEquals("y", undefined.getName());
    }

    @Test
    void testSimplifyToConstant() {
        assertEquals(new NumberNode(2), calculator.simplify(calculator.parseExpression("0 + (2*1)")));
    }

    @Test
    void testDisplayRoundTrip() {
        String[] samples = {"x + 2*y - 3", "(x - y) * (x + 1)", "2*3*x - y", "x - (y - 1)", "1.5 * x * x + 0",
                "x + 12345678", "x * 0.0001", "100000000000000000000 - y * 0.000000125"};
        double[][] points = {{0, 0}, {1, 2}, {-3, 0.5}, {2.5, -4}};

        for (String sample : samples) {
            ExpressionNode tree = calculator.parseExpression(sample);
            String display = calculator.toDisplayString(tree);
            ExpressionNode reparsed = calculator.parseExpression(display);
            System.out.println(sample + " -> " + display);

            assertEquals(calculator.simplify(tree), calculator.simplify(reparsed), sample);
            for (double[] point : points) {
                Map<String, Double> bindings = Map.of("x", point[0], "y", point[1]);
                assertEquals(calculator.evaluate(tree, bindings), calculator.evaluate(reparsed, bindings), 1e-9, sample);
            }
        }
    }

    @Test
    void testStructuralEquality() {
        assertEquals(calculator.parseExpression("x+1"), calculator.parseExpression("  x + 1 "));
        assertEquals(calculator.parseExpression("x+1").hashCode(), calculator.parseExpression("x + 1.0").hashCode());
        assertNotEquals(calculator.parseExpression("x+1"), calculator.parseExpression("1+x"));
        assertNotEquals(calculator.parseExpression("x+1"), calculator.parseExpression("x-1"));
        assertEquals(new NumberNode(0.0), new NumberNode(-0.0));
        assertEquals(new NumberNode(0.0).hashCode(), new NumberNode(-0.0).hashCode());
    }

    @Test
    void testConcurrentUseOfSharedTree() throws Exception {
        System.out.println("--- Test: Concurrent differentiation of one tree ---");
        ExpressionNode tree = calculator.parseExpression("(x^3 - 2*x) / (x + 1)");
        ExpressionNode expected = calculator.simplify(calculator.differentiate(tree));

        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<ExpressionNode>> futures = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                futures.add(executor.submit(() -> calculator.simplify(calculator.differentiate(tree))));
            }
            for (Future<ExpressionNode> future : futures) {
                assertEquals(expected, future.get(5, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
        assertEquals(calculator.parseExpression("(x^3 - 2*x) / (x + 1)"), tree);
    }
}
