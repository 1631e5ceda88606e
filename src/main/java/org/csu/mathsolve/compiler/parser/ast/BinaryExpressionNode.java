package org.csu.mathsolve.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 表示一个二元运算表达式 (e.g., 12 + 5)
 */
public record BinaryExpressionNode(
        ExpressionNode left,
        BinaryOperator operator,
        ExpressionNode right
) implements ExpressionNode {

    public BinaryExpressionNode {
        Objects.requireNonNull(left, "left");
        Objects.requireNonNull(operator, "operator");
        Objects.requireNonNull(right, "right");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBinary(this);
    }
}
