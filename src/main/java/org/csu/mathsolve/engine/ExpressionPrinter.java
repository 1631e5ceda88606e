package org.csu.mathsolve.engine;

import org.csu.mathsolve.compiler.parser.ast.*;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * @description: 把 AST 还原成规范化的字符串
 *
 * 只在必要时补括号：二元运算的子节点也是二元运算、且子节点优先级严格低于父节点时才加括号。
 * 这条规则对左右子节点一视同仁，不区分结合性，所以 a - (b - c) 如果没有显式括号会被打印成 a - b - c。
 * 源码中显式写出的括号 (GroupNode) 总是原样保留。
 */
public class ExpressionPrinter implements ExpressionNode.Visitor<String> {

    public static final int DEFAULT_SIGNIFICANT_DIGITS = 10;

    private final MathContext context;

    public ExpressionPrinter() {
        this(DEFAULT_SIGNIFICANT_DIGITS);
    }

    public ExpressionPrinter(int significantDigits) {
        if (significantDigits <= 0) {
            throw new IllegalArgumentException("significantDigits must be positive: " + significantDigits);
        }
        this.context = new MathContext(significantDigits, RoundingMode.HALF_EVEN);
    }

    public String print(ExpressionNode node) {
        return node.accept(this);
    }

    /**
     * 没有小数部分的值按整数打印，否则按有效数字位数舍入并去掉末尾的 0。
     */
    public String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (value == Math.rint(value)) {
            return decimal.toBigInteger().toString();
        }
        BigDecimal rounded = decimal.round(context).stripTrailingZeros();
        if (rounded.scale() <= 0) {
            return rounded.toBigInteger().toString();
        }
        return rounded.toPlainString();
    }

    @Override
    public String visitNumber(NumberNode node) {
        return formatNumber(node.value());
    }

    @Override
    public String visitUnary(UnaryExpressionNode node) {
        String operand = node.operand().accept(this);
        // 正号直接省略
        return node.operator() == UnaryOperator.MINUS ? "-" + operand : operand;
    }

    @Override
    public String visitBinary(BinaryExpressionNode node) {
        int precedence = node.operator().precedence();
        String left = printChild(node.left(), precedence);
        String right = printChild(node.right(), precedence);
        return left + " " + node.operator().symbol() + " " + right;
    }

    @Override
    public String visitGroup(GroupNode node) {
        return "(" + node.inner().accept(this) + ")";
    }

    private String printChild(ExpressionNode child, int parentPrecedence) {
        String text = child.accept(this);
        if (child instanceof BinaryExpressionNode binary && binary.operator().precedence() < parentPrecedence) {
            return "(" + text + ")";
        }
        return text;
    }
}
