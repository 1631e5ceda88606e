package org.csu.mathsolve.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.csu.mathsolve.config.SolverProperties;
import org.csu.mathsolve.engine.ExpressionProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 启动入口：命令行上给出的每个表达式依次求解；没有表达式时进入交互模式。
 * 以 "--" 开头的参数是 Spring 的配置项，这里忽略。
 */
@Component
public class ShellRunner implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(ShellRunner.class);

    private final ExpressionProcessor processor;
    private final SolverProperties properties;
    private final ObjectMapper objectMapper;

    public ShellRunner(ExpressionProcessor processor, SolverProperties properties, ObjectMapper objectMapper) {
        this.processor = processor;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void run(String... args) throws Exception {
        List<String> expressions = Arrays.stream(args)
                .filter(arg -> !arg.startsWith("--"))
                .collect(Collectors.toList());

        InteractiveShell shell = new InteractiveShell(processor, properties, objectMapper, System.out);
        logger.info("mathsolve started, default format '{}', step style {}",
                processor.getDefaultFormat().tag(), properties.stepStyle());

        if (expressions.isEmpty()) {
            shell.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)));
            return;
        }
        for (String expression : expressions) {
            shell.solveAndPrint(expression);
        }
    }
}
