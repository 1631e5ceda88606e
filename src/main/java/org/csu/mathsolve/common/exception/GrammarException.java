package org.csu.mathsolve.common.exception;

/**
 * Token 序列没有通过相邻关系校验 (括号不平衡、连续运算符、结尾运算符等)。
 * 校验失败时必须在语法分析之前终止处理。
 */
public class GrammarException extends ExpressionException {

    public GrammarException(String reason) {
        super(Stage.LEXICAL, "Invalid token sequence in expression: " + reason);
    }
}
