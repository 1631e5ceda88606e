package org.csu.mathsolve.config;

import org.csu.mathsolve.render.OutputFormat;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 求解器配置，对应 application.properties 中的 mathsolve.* 配置项
 *
 * @param defaultFormat     未指定输出格式时使用的格式标签
 * @param significantDigits 规范化打印小数时保留的有效数字位数
 * @param stepStyle         命令行显示哪一种步骤
 * @param prompt            交互模式的提示符
 */
@ConfigurationProperties(prefix = "mathsolve")
public record SolverProperties(
        @DefaultValue("latex")
        String defaultFormat,

        @DefaultValue("10")
        int significantDigits,

        @DefaultValue("substitution")
        StepStyle stepStyle,

        @DefaultValue("mathsolve> ")
        String prompt
) {

    public SolverProperties {
        // 提前校验，格式标签写错时启动即失败
        OutputFormat.fromTag(defaultFormat);
        if (significantDigits <= 0) {
            throw new IllegalArgumentException("mathsolve.significant-digits must be positive: " + significantDigits);
        }
        if (stepStyle == null) {
            stepStyle = StepStyle.SUBSTITUTION;
        }
    }

    public static SolverProperties defaults() {
        return new SolverProperties("latex", 10, StepStyle.SUBSTITUTION, "mathsolve> ");
    }

    public OutputFormat outputFormat() {
        return OutputFormat.fromTag(defaultFormat);
    }

    public enum StepStyle {
        SUBSTITUTION,
        OPERATION
    }
}
