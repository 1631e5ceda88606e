package org.csu.mathsolve.cli.tool;

import org.csu.mathsolve.config.SolverProperties.StepStyle;
import org.csu.mathsolve.engine.Solution;

import java.util.List;

/**
 * 把求解结果格式化为控制台文本。
 */
public class SolutionFormatter {

    public static String format(Solution solution, StepStyle stepStyle) {
        StringBuilder sb = new StringBuilder();
        sb.append("Expression: ").append(solution.normalized()).append("\n");

        List<String> steps = stepStyle == StepStyle.OPERATION ? solution.operationSteps() : solution.steps();
        if (!steps.isEmpty()) {
            sb.append("Steps:\n");
            for (int i = 0; i < steps.size(); i++) {
                sb.append("  ").append(i + 1).append(". ").append(steps.get(i)).append("\n");
            }
        }

        // 代入法步骤的最后一项总是最终结果
        List<String> snapshots = solution.steps();
        sb.append("Result: ").append(snapshots.get(snapshots.size() - 1)).append("\n");
        sb.append(solution.format().tag()).append(": ").append(solution.rendered());
        return sb.toString();
    }
}
