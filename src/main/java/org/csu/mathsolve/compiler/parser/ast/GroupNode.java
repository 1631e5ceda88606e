package org.csu.mathsolve.compiler.parser.ast;

import java.util.Objects;

/**
 * AST 节点: 源码中显式写出的一对括号。
 * 求值时透明，打印时必须原样保留。
 */
public record GroupNode(ExpressionNode inner) implements ExpressionNode {

    public GroupNode {
        Objects.requireNonNull(inner, "inner");
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitGroup(this);
    }
}
