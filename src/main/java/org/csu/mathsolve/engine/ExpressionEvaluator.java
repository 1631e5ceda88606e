package org.csu.mathsolve.engine;

import org.csu.mathsolve.common.exception.EvaluationException;
import org.csu.mathsolve.compiler.parser.ast.*;

/**
 * 表达式求值器。
 * 后序递归求值，括号节点透明，不修改 AST。
 */
public final class ExpressionEvaluator implements ExpressionNode.Visitor<Double> {

    private static final ExpressionEvaluator INSTANCE = new ExpressionEvaluator();

    private ExpressionEvaluator() {
    }

    public static double evaluate(ExpressionNode expression) {
        return expression.accept(INSTANCE);
    }

    /**
     * 计算一次二元运算。除数恰好为 0 时抛出 DivisionByZero，其余情况就是普通浮点运算。
     */
    public static double apply(BinaryOperator operator, double left, double right) {
        return switch (operator) {
            case ADD -> left + right;
            case SUB -> left - right;
            case MUL -> left * right;
            case DIV -> {
                if (right == 0) {
                    throw EvaluationException.divisionByZero();
                }
                yield left / right;
            }
        };
    }

    @Override
    public Double visitNumber(NumberNode node) {
        return node.value();
    }

    @Override
    public Double visitUnary(UnaryExpressionNode node) {
        return node.operator().apply(node.operand().accept(this));
    }

    @Override
    public Double visitBinary(BinaryExpressionNode node) {
        double left = node.left().accept(this);
        double right = node.right().accept(this);
        return apply(node.operator(), left, right);
    }

    @Override
    public Double visitGroup(GroupNode node) {
        return node.inner().accept(this);
    }
}
