package org.csu.mathsolve.engine;

import lombok.Getter;
import org.csu.mathsolve.common.exception.EvaluationException;
import org.csu.mathsolve.common.exception.ExpressionException;
import org.csu.mathsolve.common.exception.GrammarException;
import org.csu.mathsolve.compiler.lexer.Lexer;
import org.csu.mathsolve.compiler.lexer.Token;
import org.csu.mathsolve.compiler.lexer.TokenValidator;
import org.csu.mathsolve.compiler.parser.Parser;
import org.csu.mathsolve.compiler.parser.ast.ExpressionNode;
import org.csu.mathsolve.config.SolverProperties;
import org.csu.mathsolve.render.FormatConverter;
import org.csu.mathsolve.render.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * @description: 表达式处理流水线的入口
 *
 * 词法分析 -> 相邻关系校验 -> 语法分析 -> 求值 / 逐步求解 / 规范化打印 -> 渲染。
 * 任何一步失败都立即抛出带阶段标签的异常，不做部分恢复。
 *
 * 本类本身没有可变状态；有游标或步骤缓冲的对象 (Parser、StepwiseSolver 等) 每次调用都新建。
 */
public class ExpressionProcessor {

    private static final Logger logger = LoggerFactory.getLogger(ExpressionProcessor.class);

    private final Lexer lexer = new Lexer();
    private final ExpressionPrinter printer;
    @Getter
    private final OutputFormat defaultFormat;

    public ExpressionProcessor(SolverProperties properties) {
        this.printer = new ExpressionPrinter(properties.significantDigits());
        this.defaultFormat = properties.outputFormat();
    }

    public ExpressionProcessor() {
        this(SolverProperties.defaults());
    }

    /**
     * 词法分析并校验Token序列。校验不通过时直接抛出 GrammarException，不会进入语法分析。
     */
    public List<Token> tokenize(String text) {
        List<Token> tokens = lexer.tokenize(text);
        logger.debug("Tokenized {} tokens", tokens.size());
        TokenValidator.check(tokens).ifPresent(reason -> {
            throw new GrammarException(reason);
        });
        return tokens;
    }

    /**
     * 语法分析、求值、逐步求解和规范化打印。
     * 括号嵌套由 Parser 限制层数；很长的同级运算链仍可能让递归遍历栈溢出，这时转成求值阶段的异常。
     */
    public SolveResult solve(List<Token> tokens) {
        ExpressionNode ast = new Parser(tokens).parse();
        try {
            double result = ExpressionEvaluator.evaluate(ast);
            List<String> steps = new StepwiseSolver(printer).solveBySubstitution(ast);
            List<String> operationSteps = new OperationStepTracer(printer).trace(ast);
            String normalized = printer.print(ast);
            logger.debug("Normalized '{}' = {} in {} steps", normalized, result, steps.size());
            return new SolveResult(result, steps, normalized, operationSteps);
        } catch (StackOverflowError e) {
            logger.warn("Expression tree of {} tokens is too deep to solve", tokens.size());
            throw EvaluationException.nestedTooDeeply();
        }
    }

    public String render(String normalized, OutputFormat format) {
        return FormatConverter.render(normalized, format == null ? defaultFormat : format);
    }

    /**
     * 按顺序执行三个阶段，返回完整的结果。
     *
     * @param text   已纠错的表达式
     * @param format 请求的输出格式，为 null 时使用配置的默认格式
     */
    public Solution process(String text, OutputFormat format) {
        OutputFormat target = format == null ? defaultFormat : format;
        try {
            List<Token> tokens = tokenize(text);
            SolveResult result = solve(tokens);
            String normalized = result.normalized();
            return new Solution(
                    text,
                    normalized,
                    result.steps().stream().map(FormatConverter::formatStep).collect(Collectors.toList()),
                    result.operationSteps().stream().map(FormatConverter::formatStep).collect(Collectors.toList()),
                    result.finalResult(),
                    FormatConverter.toLatex(normalized),
                    FormatConverter.toMathml(normalized),
                    target,
                    render(normalized, target));
        } catch (ExpressionException e) {
            logger.debug("Processing '{}' failed at {} stage: {}", text, e.getStage().label(), e.getDetail());
            throw e;
        }
    }
}
