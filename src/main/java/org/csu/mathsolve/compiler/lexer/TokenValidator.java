package org.csu.mathsolve.compiler.lexer;

import java.util.List;
import java.util.Optional;

/**
 * Token 序列的相邻关系校验，在语法分析之前执行。
 * 只看相邻 Token 的种别码，不看它们的值。
 */
public final class TokenValidator {

    private TokenValidator() {
    }

    public static boolean validate(List<Token> tokens) {
        return check(tokens).isEmpty();
    }

    /**
     * @return 第一条不满足的规则；序列合法时返回 Optional.empty()
     */
    public static Optional<String> check(List<Token> tokens) {
        if (tokens == null || tokens.isEmpty()) {
            return Optional.of("empty expression");
        }

        TokenType prev = null;
        int depth = 0;

        for (Token token : tokens) {
            TokenType type = token.type();

            if (type == TokenType.LPAREN) {
                depth++;
            } else if (type == TokenType.RPAREN) {
                depth--;
                if (depth < 0) {
                    return Optional.of("unmatched ')' at position " + token.position());
                }
            }

            if (prev != null) {
                if (prev.isOperator() && (type.isOperator() || type == TokenType.RPAREN)) {
                    return Optional.of("'" + token.lexeme() + "' cannot follow an operator at position " + token.position());
                }
                if (prev == TokenType.NUMBER && type == TokenType.NUMBER) {
                    return Optional.of("two adjacent numbers at position " + token.position());
                }
                if (type == TokenType.LPAREN && !(prev.isOperator() || prev == TokenType.LPAREN)) {
                    return Optional.of("'(' must follow an operator or '(' at position " + token.position());
                }
            }
            prev = type;
        }

        if (depth != 0) {
            return Optional.of("unbalanced parentheses");
        }
        if (prev.isOperator()) {
            return Optional.of("expression ends with an operator");
        }
        return Optional.empty();
    }
}
