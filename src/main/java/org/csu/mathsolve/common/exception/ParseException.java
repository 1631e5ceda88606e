package org.csu.mathsolve.common.exception;

import org.csu.mathsolve.compiler.lexer.Token;

/**
 * 语法分析阶段的异常
 */
public class ParseException extends ExpressionException {

    // 出错位置的 Token，输入提前结束时为 null
    private final Token token;

    public ParseException(String message) {
        super(Stage.SYNTACTIC, message);
        this.token = null;
    }

    public ParseException(Token token, String expected) {
        super(Stage.SYNTACTIC, String.format("Expected %s, but found '%s' (%s) at position %d",
                expected,
                token.lexeme(),
                token.type(),
                token.position()));
        this.token = token;
    }

    public Token getToken() {
        return token;
    }
}
