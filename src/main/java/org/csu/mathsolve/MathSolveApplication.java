package org.csu.mathsolve;

import org.csu.mathsolve.config.SolverProperties;
import org.csu.mathsolve.engine.ExpressionProcessor;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@SpringBootApplication
@EnableConfigurationProperties(SolverProperties.class)
public class MathSolveApplication {

    public static void main(String[] args) {
        SpringApplication.run(MathSolveApplication.class, args);
    }

    @Bean
    public ExpressionProcessor expressionProcessor(SolverProperties properties) {
        return new ExpressionProcessor(properties);
    }
}
