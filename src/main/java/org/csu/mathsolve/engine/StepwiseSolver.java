package org.csu.mathsolve.engine;

import org.csu.mathsolve.compiler.parser.ast.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * @description: 代入法逐步求解器
 *
 * 先把 AST 深拷贝成一棵私有的可变树，再按后序处理：每当一个子树的所有子节点都已化简为数字，
 * 就原地把这个子树替换成数字，并从同一个根重新打印整棵树，作为一个中间步骤。
 * 与上一步相同的快照不重复记录。传入的 AST 不会被修改。
 *
 * 实例持有本次求解的步骤列表，每个输入新建一个。
 */
public class StepwiseSolver {

    private final ExpressionPrinter printer;
    private final List<String> steps = new ArrayList<>();

    public StepwiseSolver(ExpressionPrinter printer) {
        this.printer = printer;
    }

    /**
     * @return 第一项是原表达式的规范化字符串，最后一项是最终结果的数字字符串
     */
    public List<String> solveBySubstitution(ExpressionNode ast) {
        steps.clear();
        appendStep(printer.print(ast));
        WorkNode root = ast.accept(COPIER);
        for (WorkNode node : postOrder(root)) {
            if (node.reduced == null) {
                node.collapse();
                appendStep(printer.print(root.snapshot()));
            }
        }
        return Collections.unmodifiableList(new ArrayList<>(steps));
    }

    private void appendStep(String snapshot) {
        // 只去掉相邻的重复快照
        if (steps.isEmpty() || !steps.get(steps.size() - 1).equals(snapshot)) {
            steps.add(snapshot);
        }
    }

    /**
     * 用显式栈求后序 (左、右、根)，长表达式不会因为递归过深而栈溢出。
     */
    private static List<WorkNode> postOrder(WorkNode root) {
        Deque<WorkNode> pending = new ArrayDeque<>();
        List<WorkNode> order = new ArrayList<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            WorkNode node = pending.pop();
            order.add(node);
            if (node.first != null) pending.push(node.first);
            if (node.second != null) pending.push(node.second);
        }
        Collections.reverse(order);
        return order;
    }

    private static final ExpressionNode.Visitor<WorkNode> COPIER = new ExpressionNode.Visitor<>() {
        @Override
        public WorkNode visitNumber(NumberNode node) {
            WorkNode copy = new WorkNode(node, null, null);
            copy.reduced = node;
            return copy;
        }

        @Override
        public WorkNode visitUnary(UnaryExpressionNode node) {
            return new WorkNode(node, node.operand().accept(this), null);
        }

        @Override
        public WorkNode visitBinary(BinaryExpressionNode node) {
            return new WorkNode(node, node.left().accept(this), node.right().accept(this));
        }

        @Override
        public WorkNode visitGroup(GroupNode node) {
            return new WorkNode(node, node.inner().accept(this), null);
        }
    };

    /**
     * 可变树的节点。shape 只提供节点种类和运算符；化简后 reduced 非空，子节点被丢弃。
     */
    private static final class WorkNode implements ExpressionNode.Visitor<ExpressionNode> {

        private final ExpressionNode shape;
        private WorkNode first;
        private WorkNode second;
        private NumberNode reduced;

        WorkNode(ExpressionNode shape, WorkNode first, WorkNode second) {
            this.shape = shape;
            this.first = first;
            this.second = second;
        }

        /**
         * 子节点都已是数字时调用
         */
        void collapse() {
            reduced = new NumberNode(ExpressionEvaluator.evaluate(snapshot()));
            first = null;
            second = null;
        }

        ExpressionNode snapshot() {
            return reduced != null ? reduced : shape.accept(this);
        }

        @Override
        public ExpressionNode visitNumber(NumberNode node) {
            return node;
        }

        @Override
        public ExpressionNode visitUnary(UnaryExpressionNode node) {
            return new UnaryExpressionNode(node.operator(), first.snapshot());
        }

        @Override
        public ExpressionNode visitBinary(BinaryExpressionNode node) {
            return new BinaryExpressionNode(first.snapshot(), node.operator(), second.snapshot());
        }

        @Override
        public ExpressionNode visitGroup(GroupNode node) {
            return new GroupNode(first.snapshot());
        }
    }
}
