package org.csu.mathsolve.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 一元正负号 (e.g., -5, +(1 + 2))
 */
public record UnaryExpressionNode(UnaryOperator operator, ExpressionNode operand) implements ExpressionNode {

    public UnaryExpressionNode {
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(operand, "operand");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitUnary(this);
    }
}
