package org.csu.mathsolve.engine;

import java.util.List;

/**
 * 解析 + 求值 + 逐步求解 + 规范化打印 的结果
 *
 * @param finalResult    最终数值
 * @param steps          代入法快照，第一项是规范化表达式，最后一项是结果
 * @param normalized     规范化表达式
 * @param operationSteps 逐个运算的步骤 ("a op b = c")
 */
public record SolveResult(double finalResult, List<String> steps, String normalized, List<String> operationSteps) {

    public SolveResult {
        steps = List.copyOf(steps);
        operationSteps = List.copyOf(operationSteps);
    }
}
