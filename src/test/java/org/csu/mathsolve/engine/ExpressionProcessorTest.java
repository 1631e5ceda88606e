package org.csu.mathsolve.engine;

import org.csu.mathsolve.common.exception.*;
import org.csu.mathsolve.compiler.lexer.Token;
import org.csu.mathsolve.config.SolverProperties;
import org.csu.mathsolve.render.OutputFormat;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 整条流水线的集成测试：词法 -> 校验 -> 语法 -> 求值/步骤/打印 -> 渲染
 */
public class ExpressionProcessorTest {

    private final ExpressionProcessor processor = new ExpressionProcessor();

    @Test
    void testFullPipeline() {
        System.out.println("--- Running test: testFullPipeline ---");
        Solution solution = processor.process("12+(5*4)-1", null);
        System.out.println("Solution: " + solution);

        assertEquals(31, solution.finalResult(), 1e-9);
        assertEquals("12 + (5 * 4) - 1", solution.normalized());
        assertEquals(List.of("12 + (5 × 4) - 1", "12 + (20) - 1", "12 + 20 - 1", "32 - 1", "31"), solution.steps());
        assertEquals(List.of("5 × 4 = 20", "12 + 20 = 32", "32 - 1 = 31"), solution.operationSteps());
        assertEquals("$12 + \\left(5 \\times 4\\right) - 1$", solution.latex());
        assertTrue(solution.mathml().startsWith("<math><mrow><mn>12</mn>"));
        // 未指定格式时默认 LaTeX
        assertEquals(OutputFormat.LATEX, solution.format());
        assertEquals(solution.latex(), solution.rendered());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testRequestedFormat() {
        assertEquals(processor.process("2+3*4", OutputFormat.MATHML).rendered(),
                processor.render("2 + 3 * 4", OutputFormat.MATHML));
        assertEquals("2 + 3 * 4", processor.process("2+3*4", OutputFormat.PLAIN).rendered());
        assertEquals("$2 + 3 \\times 4$", processor.render("2 + 3 * 4", null));
    }

    @Test
    void testSolveContract() {
        List<Token> tokens = processor.tokenize("8-4/2+1");
        SolveResult result = processor.solve(tokens);
        assertEquals(7, result.finalResult(), 1e-9);
        assertEquals("8 - 4 / 2 + 1", result.normalized());
        assertEquals("7", result.steps().get(result.steps().size() - 1));
        assertEquals(List.of("4 / 2 = 2", "8 - 2 = 6", "6 + 1 = 7"), result.operationSteps());
    }

    @Test
    void testGrammarCheckShortCircuitsBeforeParsing() {
        System.out.println("--- Running test: testGrammarCheckShortCircuitsBeforeParsing ---");
        GrammarException e = assertThrows(GrammarException.class, () -> processor.tokenize("1+"));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(ExpressionException.Stage.LEXICAL, e.getStage());
        assertTrue(e.getMessage().startsWith("lexical error: Invalid token sequence"), e.getMessage());

        assertThrows(GrammarException.class, () -> processor.process("", null));
        assertThrows(GrammarException.class, () -> processor.process("(1+2", null));
        assertThrows(GrammarException.class, () -> processor.process("1**2", null));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEachStageIsTagged() {
        LexException lex = assertThrows(LexException.class, () -> processor.process("2$3", null));
        assertEquals("lexical", lex.getStage().label());

        // "()" 通过了相邻关系校验，但语法上缺少表达式
        ParseException parse = assertThrows(ParseException.class, () -> processor.process("()", null));
        assertEquals("syntactic", parse.getStage().label());

        EvaluationException eval = assertThrows(EvaluationException.class, () -> processor.process("4/(2-2)", null));
        assertEquals("evaluation", eval.getStage().label());
        assertEquals(EvaluationException.Reason.DIVISION_BY_ZERO, eval.getReason());
    }

    @Test
    void testConfiguredPrecisionAndFormat() {
        SolverProperties properties = new SolverProperties("plain", 3, SolverProperties.StepStyle.SUBSTITUTION, "> ");
        ExpressionProcessor coarse = new ExpressionProcessor(properties);

        Solution solution = coarse.process("1/3", null);
        assertEquals(OutputFormat.PLAIN, solution.format());
        assertEquals("1 ÷ 3", solution.steps().get(0));
        assertEquals("0.333", solution.steps().get(solution.steps().size() - 1));
        assertEquals("1 / 3", solution.rendered());
        assertEquals(1.0 / 3, solution.finalResult(), 1e-12, "最终结果不受打印精度影响");
    }

    @Test
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class,
                () -> new SolverProperties("svg", 10, SolverProperties.StepStyle.SUBSTITUTION, "> "));
        assertThrows(IllegalArgumentException.class,
                () -> new SolverProperties("latex", 0, SolverProperties.StepStyle.SUBSTITUTION, "> "));
        assertEquals(SolverProperties.StepStyle.SUBSTITUTION,
                new SolverProperties("latex", 10, null, "> ").stepStyle());
    }

    @Test
    void testLongSumIsSolved() {
        System.out.println("--- Running test: testLongSumIsSolved ---");
        Solution solution = processor.process("1" + "+1".repeat(1000), OutputFormat.PLAIN);
        assertEquals(1001, solution.finalResult(), 1e-9);
        assertEquals("1001", solution.steps().get(solution.steps().size() - 1));
        assertEquals(1000, solution.operationSteps().size());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testDeepNestingIsReportedAsStagedError() {
        System.out.println("--- Running test: testDeepNestingIsReportedAsStagedError ---");
        String nested = "(".repeat(5000) + "1" + ")".repeat(5000);
        ParseException e = assertThrows(ParseException.class, () -> processor.process(nested, null));
        System.out.println("Caught expected exception: " + e.getMessage());
        assertEquals(ExpressionException.Stage.SYNTACTIC, e.getStage());

        // 没有括号的超长运算链在求值阶段报错，而不是抛出 StackOverflowError
        String chain = "1" + "+1".repeat(100_000);
        EvaluationException tooDeep = assertThrows(EvaluationException.class, () -> processor.process(chain, null));
        assertEquals(EvaluationException.Reason.NESTED_TOO_DEEPLY, tooDeep.getReason());
        assertEquals("evaluation error: Expression nested too deeply", tooDeep.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOversizedLiteralIsSyntacticError() {
        ParseException e = assertThrows(ParseException.class,
                () -> processor.process("1" + "0".repeat(400) + "+1", null));
        assertEquals(ExpressionException.Stage.SYNTACTIC, e.getStage());
    }
}
