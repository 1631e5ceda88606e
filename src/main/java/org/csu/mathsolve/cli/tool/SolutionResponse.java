package org.csu.mathsolve.cli.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.csu.mathsolve.common.exception.ExpressionException;
import org.csu.mathsolve.engine.Solution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对外输出的 JSON 信封，成功时带求解结果，失败时带错误信息和出错阶段
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SolutionResponse(
        String status,
        String input,
        String normalized,
        List<String> steps,
        Double finalResult,
        Map<String, String> exportFormats,
        String error,
        String stage
) {

    public static SolutionResponse success(Solution solution) {
        return new SolutionResponse(
                "success",
                solution.input(),
                solution.normalized(),
                solution.steps(),
                solution.finalResult(),
                exportFormats(solution),
                null,
                null);
    }

    /**
     * latex 在前，mathml 在后，JSON 输出的键顺序固定
     */
    private static Map<String, String> exportFormats(Solution solution) {
        Map<String, String> formats = new LinkedHashMap<>();
        formats.put("latex", solution.latex());
        formats.put("mathml", solution.mathml());
        return formats;
    }

    public static SolutionResponse error(String input, ExpressionException e) {
        return new SolutionResponse(
                "error",
                input,
                null,
                null,
                null,
                null,
                e.getMessage(),
                e.getStage().label());
    }
}
