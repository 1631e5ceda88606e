package org.csu.mathsolve.common.exception;

import lombok.Getter;

/**
 * 词法分析阶段的异常：输入中出现了无法匹配任何 Token 的字符。
 */
@Getter
public class LexException extends ExpressionException {

    private final char offendingChar;
    // 在原始输入(去除空白之前)中的下标
    private final int position;

    public LexException(char offendingChar, int position) {
        super(Stage.LEXICAL, String.format("Invalid character '%c' at position %d", offendingChar, position));
        this.offendingChar = offendingChar;
        this.position = position;
    }
}
