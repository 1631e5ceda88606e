package org.csu.mathsolve.common.exception;

import lombok.Getter;

/**
 * @description: 表达式处理流水线中所有错误的公共父类
 *
 * 每个异常都带有所属阶段 (lexical / syntactic / evaluation)，
 * getMessage() 返回带阶段前缀的信息，getDetail() 返回原始描述。
 */
@Getter
public abstract class ExpressionException extends RuntimeException {

    private final Stage stage;
    private final String detail;

    protected ExpressionException(Stage stage, String detail) {
        super(stage.label() + " error: " + detail);
        this.stage = stage;
        this.detail = detail;
    }

    public enum Stage {
        LEXICAL("lexical"),
        SYNTACTIC("syntactic"),
        EVALUATION("evaluation");

        private final String label;

        Stage(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
