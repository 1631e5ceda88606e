package org.csu.mathsolve.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.csu.mathsolve.cli.tool.SolutionFormatter;
import org.csu.mathsolve.cli.tool.SolutionResponse;
import org.csu.mathsolve.common.exception.ExpressionException;
import org.csu.mathsolve.config.SolverProperties;
import org.csu.mathsolve.engine.ExpressionProcessor;
import org.csu.mathsolve.engine.Solution;
import org.csu.mathsolve.render.OutputFormat;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.Locale;

/**
 * 交互式命令行：每行一个表达式。
 *
 * <ul>
 *     <li>{@code exit} / {@code quit} 退出</li>
 *     <li>{@code :format latex|mathml|plain} 切换输出格式</li>
 *     <li>{@code :json} 切换 JSON 输出</li>
 * </ul>
 */
public class InteractiveShell {

    private final ExpressionProcessor processor;
    private final SolverProperties properties;
    private final ObjectMapper objectMapper;
    private final PrintStream out;

    private OutputFormat format;
    private boolean json = false;

    public InteractiveShell(ExpressionProcessor processor, SolverProperties properties,
                            ObjectMapper objectMapper, PrintStream out) {
        this.processor = processor;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.out = out;
        this.format = properties.outputFormat();
    }

    public void run(BufferedReader in) throws IOException {
        out.println("Type an arithmetic expression, ':format <latex|mathml|plain>', ':json' or 'exit'.");
        while (true) {
            out.print(properties.prompt());
            out.flush();
            String line = in.readLine();
            if (line == null) {
                break;
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            if (line.equalsIgnoreCase("exit") || line.equalsIgnoreCase("quit")) {
                break;
            }
            if (line.startsWith(":")) {
                handleCommand(line);
                continue;
            }
            solveAndPrint(line);
            out.println();
        }
        out.println("Bye!");
    }

    /**
     * 求解一个表达式并打印结果。出错时打印带阶段的错误信息，不中断后续输入。
     *
     * @return 是否求解成功
     */
    public boolean solveAndPrint(String expression) {
        try {
            Solution solution = processor.process(expression, format);
            out.println(json ? toJson(SolutionResponse.success(solution))
                    : SolutionFormatter.format(solution, properties.stepStyle()));
            return true;
        } catch (ExpressionException e) {
            out.println(json ? toJson(SolutionResponse.error(expression, e)) : "ERROR: " + e.getMessage());
            return false;
        }
    }

    public OutputFormat getFormat() {
        return format;
    }

    public boolean isJson() {
        return json;
    }

    private void handleCommand(String line) {
        String[] parts = line.split("\\s+", 2);
        switch (parts[0].toLowerCase(Locale.ROOT)) {
            case ":format" -> {
                try {
                    format = OutputFormat.fromTag(parts.length > 1 ? parts[1] : null, properties.outputFormat());
                    out.println("Output format: " + format.tag());
                } catch (IllegalArgumentException e) {
                    out.println("ERROR: " + e.getMessage());
                }
            }
            case ":json" -> {
                json = !json;
                out.println("JSON output " + (json ? "on" : "off"));
            }
            default -> out.println("ERROR: Unknown command " + parts[0]);
        }
    }

    private String toJson(SolutionResponse response) {
        try {
            return objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
    }
}
