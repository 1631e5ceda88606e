package org.csu.mathsolve.compiler.parser.ast;

/**
 * 所有 AST 节点的公共接口。
 * 节点种类是封闭的，消费方通过 Visitor 处理每一种节点，不存在“未知节点”分支。
 */
public sealed interface ExpressionNode
        permits NumberNode, UnaryExpressionNode, BinaryExpressionNode, GroupNode {

    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor模式接口，新增一种处理方式时只需实现这四个方法
     * @param <R> 处理结果的类型
     */
    interface Visitor<R> {
        R visitNumber(NumberNode node);

        R visitUnary(UnaryExpressionNode node);

        R visitBinary(BinaryExpressionNode node);

        R visitGroup(GroupNode node);
    }
}
