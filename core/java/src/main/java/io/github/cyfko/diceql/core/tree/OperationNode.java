package io.github.cyfko.diceql.core.tree;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.api.ExpressionNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;

/**
 * Binary node applying an {@link ArithmeticOp} to two evaluated subtrees.
 * <p>
 * The value is computed once, from the children's values, when the node is constructed.
 * </p>
 *
 * @since 1.0.0
 */
public final class OperationNode implements ExpressionNode {

    private final ExpressionNode left;
    private final ExpressionNode right;
    private final ArithmeticOp op;
    private final int value;

    /**
     * @throws ArithmeticException if the value does not fit in an {@code int}
     */
    public OperationNode(ExpressionNode left, ExpressionNode right, ArithmeticOp op) {
        this.left = Objects.requireNonNull(left, "left operand cannot be null");
        this.right = Objects.requireNonNull(right, "right operand cannot be null");
        this.op = Objects.requireNonNull(op, "operator cannot be null");
        this.value = op.apply(left.value(), right.value());
    }

    public ExpressionNode getLeft() {
        return left;
    }

    public ExpressionNode getRight() {
        return right;
    }

    public ArithmeticOp getOp() {
        return op;
    }

    @Override
    public int value() {
        return value;
    }

    @Override
    public String render() {
        return flatten(false);
    }

    @Override
    public boolean isLeaf() {
        return false;
    }

    @Override
    public String toString() {
        return flatten(true);
    }

    /**
     * Walks the tree in order with an explicit stack, so chains of thousands of dice
     * do not exhaust the call stack.
     *
     * @param debug true for the {@code toString()} form, false for {@code render()}
     */
    private String flatten(boolean debug) {
        StringBuilder out = new StringBuilder();
        Deque<Object> pending = new ArrayDeque<>();
        pending.push(this);

        while (!pending.isEmpty()) {
            Object next = pending.pop();
            if (next instanceof OperationNode node) {
                if (debug) pending.push("]");
                pending.push(node.right);
                pending.push(" " + node.op.getSymbol() + " ");
                pending.push(node.left);
                if (debug) out.append("OperationNode[");
            } else if (next instanceof ExpressionNode leaf) {
                out.append(debug ? leaf.toString() : leaf.render());
            } else {
                out.append(next);
            }
        }
        return out.toString();
    }
}
