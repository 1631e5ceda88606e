package org.csu.mathsolve.common.exception;

import lombok.Getter;

/**
 * 求值阶段的异常
 */
@Getter
public class EvaluationException extends ExpressionException {

    private final Reason reason;

    public EvaluationException(Reason reason, String message) {
        super(Stage.EVALUATION, message);
        this.reason = reason;
    }

    public static EvaluationException divisionByZero() {
        return new EvaluationException(Reason.DIVISION_BY_ZERO, "Division by zero");
    }

    /**
     * 表达式树太深，求值或逐步求解时调用栈不够用
     */
    public static EvaluationException nestedTooDeeply() {
        return new EvaluationException(Reason.NESTED_TOO_DEEPLY, "Expression nested too deeply");
    }

    public enum Reason {
        DIVISION_BY_ZERO,
        NESTED_TOO_DEEPLY
    }
}
