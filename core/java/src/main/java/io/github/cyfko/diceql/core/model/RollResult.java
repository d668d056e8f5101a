package io.github.cyfko.diceql.core.model;

import io.github.cyfko.diceql.core.api.ExpressionNode;

import java.util.Objects;

/**
 * Outcome of evaluating a roll expression: the total and its human-readable breakdown.
 *
 * <pre>{@code
 * RollResult result = parser.evaluate("2d6+3");
 * result.total();     // e.g. 11
 * result.rendered();  // e.g. "2(d6) + !*6*!(d6) + 3"
 * result.format();    // e.g. "2(d6) + !*6*!(d6) + 3 = 11"
 * }</pre>
 *
 * @param total    the value of the expression
 * @param rendered the breakdown showing every individual die result
 * @since 1.0.0
 */
public record RollResult(int total, String rendered) {

    public RollResult {
        Objects.requireNonNull(rendered, "rendered cannot be null");
    }

    /**
     * Captures the value and the rendering of an evaluated tree.
     *
     * @param root the root of an evaluated expression tree
     * @return the roll result
     */
    public static RollResult of(ExpressionNode root) {
        Objects.requireNonNull(root, "root cannot be null");
        return new RollResult(root.value(), root.render());
    }

    /**
     * @return {@code "{rendered} = {total}"}
     */
    public String format() {
        return rendered + " = " + total;
    }
}
