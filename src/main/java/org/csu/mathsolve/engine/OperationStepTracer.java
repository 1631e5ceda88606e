package org.csu.mathsolve.engine;

import org.csu.mathsolve.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 另一种步骤格式：每执行一次运算记录一行 "a op b = c"，一元运算记录 "-a = c"。
 * 括号不产生步骤。这是代入法快照之外的辅助输出。
 */
public class OperationStepTracer implements ExpressionNode.Visitor<Double> {

    private final ExpressionPrinter printer;
    private final List<String> steps = new ArrayList<>();

    public OperationStepTracer(ExpressionPrinter printer) {
        this.printer = printer;
    }

    public List<String> trace(ExpressionNode ast) {
        steps.clear();
        ast.accept(this);
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    @Override
    public Double visitNumber(NumberNode node) {
        return node.value();
    }

    @Override
    public Double visitUnary(UnaryExpressionNode node) {
        double operand = node.operand().accept(this);
        double result = node.operator().apply(operand);
        steps.add(node.operator().symbol() + printer.formatNumber(operand) + " = " + printer.formatNumber(result));
        return result;
    }

    @Override
    public Double visitBinary(BinaryExpressionNode node) {
        double left = node.left().accept(this);
        double right = node.right().accept(this);
        double result = ExpressionEvaluator.apply(node.operator(), left, right);
        steps.add(printer.formatNumber(left) + " " + node.operator().symbol() + " "
                + printer.formatNumber(right) + " = " + printer.formatNumber(result));
        return result;
    }

    @Override
    public Double visitGroup(GroupNode node) {
        return node.inner().accept(this);
    }
}
