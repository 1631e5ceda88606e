package org.csu.mathsolve.engine;

import org.csu.mathsolve.compiler.lexer.Lexer;
import org.csu.mathsolve.compiler.parser.Parser;
import org.csu.mathsolve.compiler.parser.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 规范化打印的测试
 */
public class ExpressionPrinterTest {

    private final ExpressionPrinter printer = new ExpressionPrinter();

    private ExpressionNode parse(String expression) {
        return new Parser(new Lexer().tokenize(expression)).parse();
    }

    @Test
    void testExplicitParenthesesArePreserved() {
        System.out.println("--- Running test: testExplicitParenthesesArePreserved ---");
        assertEquals("12 + (5 * 4) - 1", printer.print(parse("12+(5*4)-1")));
        assertEquals("(10 + 2) * 3 - 5", printer.print(parse("(10+2)*3-5")));
        assertEquals("((1))", printer.print(parse("((1))")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNumberFormatting() {
        System.out.println("--- Running test: testNumberFormatting ---");
        assertEquals("31", printer.formatNumber(31.0));
        assertEquals("2.5", printer.formatNumber(2.5));
        assertEquals("9.78", printer.formatNumber(3.14 * 2 + 7.0 / 2));
        assertEquals("0.3", printer.formatNumber(0.1 + 0.2));
        assertEquals("0.3333333333", printer.formatNumber(1.0 / 3));
        assertEquals("0.6666666667", printer.formatNumber(2.0 / 3));
        assertEquals("-13", printer.formatNumber(-13.0));
        assertEquals("0", printer.formatNumber(-0.0));
        assertEquals("100000000000000000000", printer.formatNumber(1e20));
        assertEquals("Infinity", printer.formatNumber(Double.POSITIVE_INFINITY));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testSignificantDigitBudget() {
        ExpressionPrinter coarse = new ExpressionPrinter(3);
        assertEquals("0.333", coarse.formatNumber(1.0 / 3));
        assertEquals("123000", coarse.formatNumber(123456.789));
        assertEquals("3", coarse.formatNumber(2.9999));
        assertThrows(IllegalArgumentException.class, () -> new ExpressionPrinter(0));
    }

    @Test
    void testUnarySigns() {
        assertEquals("-5 + 3", printer.print(parse("-5+3")));
        // 正号被省略
        assertEquals("2", printer.print(parse("+2")));
        assertEquals("-(1 + 2)", printer.print(parse("-(1+2)")));
    }

    @Test
    void testLowerPrecedenceChildIsWrapped() {
        NumberNode one = new NumberNode(1);
        NumberNode two = new NumberNode(2);
        NumberNode three = new NumberNode(3);

        BinaryExpressionNode sum = new BinaryExpressionNode(one, BinaryOperator.ADD, two);
        assertEquals("(1 + 2) * 3", printer.print(new BinaryExpressionNode(sum, BinaryOperator.MUL, three)));
        assertEquals("3 * (1 + 2)", printer.print(new BinaryExpressionNode(three, BinaryOperator.MUL, sum)));

        BinaryExpressionNode product = new BinaryExpressionNode(one, BinaryOperator.MUL, two);
        assertEquals("1 * 2 + 3", printer.print(new BinaryExpressionNode(product, BinaryOperator.ADD, three)));
    }

    @Test
    void testEqualPrecedenceOnTheRightIsNotWrapped() {
        // 只比较优先级，不考虑结合性：右侧同级的减法会丢掉括号
        BinaryExpressionNode inner = new BinaryExpressionNode(new NumberNode(2), BinaryOperator.SUB, new NumberNode(3));
        BinaryExpressionNode outer = new BinaryExpressionNode(new NumberNode(1), BinaryOperator.SUB, inner);
        assertEquals("1 - 2 - 3", printer.print(outer));

        BinaryExpressionNode quotient = new BinaryExpressionNode(new NumberNode(8), BinaryOperator.DIV, new NumberNode(2));
        assertEquals("16 / 8 / 2",
                printer.print(new BinaryExpressionNode(new NumberNode(16), BinaryOperator.DIV, quotient)));
    }

    @Test
    void testRoundTripKeepsTheValue() {
        System.out.println("--- Running test: testRoundTripKeepsTheValue ---");
        for (String expression : List.of("12+(5*4)-1", "8-4/2+1", "(10+2)*3-5", "3.14*2+7/2",
                "1-(2-3)*5", "-(4/(1+1))", "2/(3-(4*5))")) {
            ExpressionNode ast = parse(expression);
            String printed = printer.print(ast);
            double reparsed = ExpressionEvaluator.evaluate(parse(printed));
            System.out.println(expression + " -> " + printed);
            assertEquals(ExpressionEvaluator.evaluate(ast), reparsed, 1e-9, expression);
        }
        System.out.println("Result: Test PASSED.\n");
    }
}
