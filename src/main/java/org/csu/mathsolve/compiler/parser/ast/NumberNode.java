package org.csu.mathsolve.compiler.parser.ast;

/**
 * AST 节点: 数值字面量，永远是叶子节点
 */
public record NumberNode(double value) implements ExpressionNode {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
