package io.github.cyfko.diceql.core.api;

/**
 * Node of an evaluated roll expression tree.
 * <p>
 * Nodes are immutable and evaluated eagerly: every die is rolled exactly once while the
 * tree is being built, so {@link #value()} and {@link #render()} never roll again and
 * always return the same result for the same node.
 * </p>
 *
 * <h2>Rendering</h2>
 * <ul>
 *   <li>Operation: {@code "{left} {symbol} {right}"}</li>
 *   <li>Literal: the integer, e.g. {@code "4"}</li>
 *   <li>Die: {@code "{value}(d{faces})"}, e.g. {@code "3(d6)"}</li>
 *   <li>Die at its natural maximum: {@code "!*{value}*!(d{faces})"}, e.g. {@code "!*6*!(d6)"}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public interface ExpressionNode {

    /**
     * @return the evaluated value of this subtree
     */
    int value();

    /**
     * Renders the subtree as a human-readable trace showing each individual die result.
     *
     * @return the rendered trace
     */
    String render();

    /**
     * @return true for leaves (dice and literals), false for operations
     */
    boolean isLeaf();
}
