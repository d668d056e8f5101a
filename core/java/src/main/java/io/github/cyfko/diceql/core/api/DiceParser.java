package io.github.cyfko.diceql.core.api;

import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.model.RollResult;

/**
 * Parser turning tabletop roll expressions into evaluated {@link ExpressionNode} trees.
 *
 * <h2>Expression Grammar</h2>
 * <pre>
 * expression := operand (('+' | '-') operand)*
 * operand    := die | literal
 * die        := [0-9]* 'd' [0-9]+
 * literal    := '-'? [0-9]+
 * </pre>
 * <p>
 * A literal may only carry a sign right after a {@code '-'} operator, as in {@code "5--3"}.
 * Whitespace around operands is ignored.
 * </p>
 *
 * <h2>Operator Placement</h2>
 * <p>
 * The root of each subtree is the <em>last</em> {@code '-'} if there is one, otherwise the
 * <em>first</em> {@code '+'}. Everything on the right of the root becomes the right subtree.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * DiceParser parser = new BasicDiceParser();
 *
 * parser.evaluate("7");           // 7 = 7
 * parser.evaluate("3d6");         // 2(d6) + 5(d6) + !*6*!(d6) = 13
 * parser.evaluate("2d6+3-1d4");   // 1(d6) + 4(d6) + 3 - 2(d4) = 6
 * }</pre>
 *
 * <h2>Invalid Expression Examples</h2>
 * <pre>{@code
 * parser.evaluate("+5");     // MALFORMED_OPERATOR_PLACEMENT
 * parser.evaluate("3+");     // MALFORMED_OPERATOR_PLACEMENT
 * parser.evaluate("d");      // MALFORMED_DIE_TERM
 * parser.evaluate("3x");     // INVALID_LITERAL
 * }</pre>
 *
 * @since 1.0.0
 * @see DiceSyntaxException
 */
public interface DiceParser {

    /**
     * Parses and evaluates a roll expression into an expression tree.
     *
     * @param expression the raw expression, e.g. {@code "2d6+3-1d4"}
     * @return the root of the evaluated tree
     * @throws DiceSyntaxException if the expression is blank, malformed or exceeds policy limits
     */
    ExpressionNode parse(String expression) throws DiceSyntaxException;

    /**
     * Evaluates a roll expression into its total and rendered breakdown.
     *
     * @param expression the raw expression
     * @return the total and the rendered trace of the single evaluation performed
     * @throws DiceSyntaxException if the expression is blank, malformed or exceeds policy limits
     */
    default RollResult evaluate(String expression) throws DiceSyntaxException {
        return RollResult.of(parse(expression));
    }
}
