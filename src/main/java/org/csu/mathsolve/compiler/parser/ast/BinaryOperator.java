package org.csu.mathsolve.compiler.parser.ast;

/**
 * 四则运算符及其优先级。
 * 优先级只用于打印时决定是否补括号，解析阶段的优先级由文法层次保证。
 */
public enum BinaryOperator {
    ADD("+", 1),
    SUB("-", 1),
    MUL("*", 2),
    DIV("/", 2);

    private final String symbol;
    private final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public String symbol() {
        return symbol;
    }

    public int precedence() {
        return precedence;
    }
}
