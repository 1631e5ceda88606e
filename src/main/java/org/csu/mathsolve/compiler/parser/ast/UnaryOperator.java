package org.csu.mathsolve.compiler.parser.ast;

public enum UnaryOperator {
    PLUS("+"),
    MINUS("-");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public double apply(double operand) {
        return this == MINUS ? -operand : operand;
    }
}
