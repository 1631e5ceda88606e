package org.csu.mathsolve.engine;

import org.csu.mathsolve.render.OutputFormat;

import java.util.List;

/**
 * 整条流水线的输出，供命令行或其他调用方序列化
 *
 * @param input          调用方传入的表达式
 * @param normalized     规范化表达式
 * @param steps          适合展示的代入法步骤 (× ÷)
 * @param operationSteps 适合展示的逐运算步骤 (× ÷)
 * @param finalResult    最终数值
 * @param latex          LaTeX 形式
 * @param mathml         MathML 形式
 * @param format         调用方请求的格式
 * @param rendered       按请求格式渲染的结果
 */
public record Solution(
        String input,
        String normalized,
        List<String> steps,
        List<String> operationSteps,
        double finalResult,
        String latex,
        String mathml,
        OutputFormat format,
        String rendered
) {

    public Solution {
        steps = List.copyOf(steps);
        operationSteps = List.copyOf(operationSteps);
    }
}
