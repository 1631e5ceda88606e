package org.csu.mathsolve.render;

import java.util.List;

/**
 * @description: 把规范化后的表达式转换为 LaTeX / MathML / 便于阅读的形式
 *
 * 输入是 ExpressionPrinter 的输出，这里只做逐个片段的映射，不做任何语义处理。
 * 所有方法都是纯函数，可以并发调用。
 */
public final class FormatConverter {

    // LaTeX 中的小数点写成德语区习惯的逗号
    private static final String LATEX_DECIMAL_MARKER = "{,}";

    private FormatConverter() {
    }

    public static String render(String normalized, OutputFormat format) {
        return switch (format) {
            case LATEX -> toLatex(normalized);
            case MATHML -> toMathml(normalized);
            case PLAIN -> normalized;
        };
    }

    public static String toLatex(String normalized) {
        StringBuilder sb = new StringBuilder();
        for (String part : NotationScanner.scan(normalized)) {
            switch (part) {
                case "+", "-" -> sb.append(' ').append(part).append(' ');
                case "*" -> sb.append(" \\times ");
                case "/" -> sb.append(" \\div ");
                case "(" -> sb.append("\\left(");
                case ")" -> sb.append("\\right)");
                default -> sb.append(part.replace(".", LATEX_DECIMAL_MARKER));
            }
        }
        return "$" + sb.toString().trim() + "$";
    }

    /**
     * 输出一个扁平的 mrow。带小数点的数字会被拆成 整数部分 mn、一个 &lt;mo&gt;.&lt;/mo&gt;、小数部分 mn 三个元素。
     */
    public static String toMathml(String normalized) {
        List<String> parts = NotationScanner.scan(normalized);
        StringBuilder sb = new StringBuilder("<math><mrow>");
        for (String part : parts) {
            if (NotationScanner.isDelimiter(part)) {
                sb.append("<mo>").append(operatorGlyph(part)).append("</mo>");
                continue;
            }
            int dot = part.indexOf('.');
            if (dot >= 0) {
                sb.append("<mn>").append(part, 0, dot).append("</mn>");
                sb.append("<mo>.</mo>");
                sb.append("<mn>").append(part.substring(dot + 1)).append("</mn>");
            } else {
                sb.append("<mn>").append(part).append("</mn>");
            }
        }
        sb.append("</mrow></math>");
        return sb.toString();
    }

    public static String toReadable(String normalized) {
        return normalized.replace("*", "×").replace("/", "÷");
    }

    /**
     * 仅用于展示：把 * 和 / 换成 × 和 ÷
     */
    public static String formatStep(String step) {
        return toReadable(step);
    }

    private static String operatorGlyph(String operator) {
        return switch (operator) {
            case "*" -> "×";
            case "/" -> "÷";
            default -> operator;
        };
    }
}
