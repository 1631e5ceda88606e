package org.csu.mathsolve.compiler.parser;

import org.csu.mathsolve.common.exception.ParseException;
import org.csu.mathsolve.compiler.lexer.Token;
import org.csu.mathsolve.compiler.lexer.TokenType;
import org.csu.mathsolve.compiler.parser.ast.*;

import java.util.List;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)
 *
 * <pre>
 * expression := term (('+'|'-') term)*
 * term       := factor (('*'|'/') factor)*
 * factor     := NUMBER
 *             | '(' expression ')'
 *             | ('+'|'-') factor
 * </pre>
 *
 * 同一优先级的运算向左折叠，生成左倾的树。
 * 实例持有游标状态，每个输入新建一个，不能在线程间共享。
 */
public class Parser {

    /**
     * 括号和一元符号的最大嵌套层数，超过时直接报错，避免递归下降栈溢出
     */
    public static final int MAX_NESTING_DEPTH = 500;

    private final List<Token> tokens;
    private int position = 0;
    private int depth = 0;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * 解析整个Token序列。失败时抛出异常，不返回部分AST。
     */
    public ExpressionNode parse() {
        if (tokens.isEmpty()) {
            throw new ParseException("Unexpected end of expression");
        }
        ExpressionNode expression = parseExpression();
        if (!isAtEnd()) {
            throw new ParseException(peek(), "end of expression");
        }
        return expression;
    }

    private ExpressionNode parseExpression() {
        ExpressionNode left = parseTerm();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            BinaryOperator operator = previous().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            ExpressionNode right = parseTerm();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseTerm() {
        ExpressionNode left = parseFactor();
        while (match(TokenType.MULTIPLY, TokenType.DIVIDE)) {
            BinaryOperator operator = previous().type() == TokenType.MULTIPLY ? BinaryOperator.MUL : BinaryOperator.DIV;
            ExpressionNode right = parseFactor();
            left = new BinaryExpressionNode(left, operator, right);
        }
        return left;
    }

    private ExpressionNode parseFactor() {
        if (isAtEnd()) {
            throw new ParseException("Unexpected end of expression");
        }
        if (match(TokenType.NUMBER)) {
            Token number = previous();
            double value;
            try {
                value = Double.parseDouble(number.lexeme());
            } catch (NumberFormatException e) {
                throw new ParseException(number, "a numeric literal");
            }
            // 超过 double 范围的字面量会变成 Infinity
            if (Double.isInfinite(value)) {
                throw new ParseException(number, "a numeric literal");
            }
            return new NumberNode(value);
        }
        if (match(TokenType.LPAREN)) {
            enterNested();
            ExpressionNode inner = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            depth--;
            return new GroupNode(inner);
        }
        if (match(TokenType.PLUS, TokenType.MINUS)) {
            UnaryOperator operator = previous().type() == TokenType.PLUS ? UnaryOperator.PLUS : UnaryOperator.MINUS;
            enterNested();
            ExpressionNode operand = parseFactor();
            depth--;
            return new UnaryExpressionNode(operator, operand);
        }
        throw new ParseException(peek(), "a number, '(' or a sign");
    }

    private void enterNested() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw new ParseException("Expression nested too deeply at position " + previous().position()
                    + " (at most " + MAX_NESTING_DEPTH + " levels)");
        }
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        if (isAtEnd()) {
            throw new ParseException("Unexpected end of expression, expected " + message);
        }
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return position >= tokens.size();
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
