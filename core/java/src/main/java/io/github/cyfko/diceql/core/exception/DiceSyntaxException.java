package io.github.cyfko.diceql.core.exception;

import io.github.cyfko.diceql.core.api.DiceParser;
import io.github.cyfko.diceql.core.impl.BasicDiceParser;

/**
 * Exception thrown when a roll expression cannot be parsed into an expression tree.
 * <p>
 * Every failure aborts evaluation of the whole expression: no partial tree is ever
 * returned. The {@link ErrorKind} tells callers which rule the input broke, so that
 * user interfaces and tests can distinguish cases without inspecting messages.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.evaluate("+5");
 * // → MALFORMED_OPERATOR_PLACEMENT: "Operator '+' at position 0 has no left operand"
 *
 * parser.evaluate("3+");
 * // → MALFORMED_OPERATOR_PLACEMENT: "Operator '+' at position 1 has no right operand"
 *
 * parser.evaluate("d");
 * // → MALFORMED_DIE_TERM: "Die term 'd' at position 0 has no face count"
 *
 * parser.evaluate("3x");
 * // → INVALID_LITERAL: "Term '3x' at position 0 is neither a die nor an integer"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     RollResult result = parser.evaluate(line);
 *     out.println(result.format());
 * } catch (DiceSyntaxException e) {
 *     out.println("Invalid roll: " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 * @see DiceParser
 * @see BasicDiceParser
 */
public class DiceSyntaxException extends RuntimeException {

    /** Position returned by {@link #getPosition()} when no position is known. */
    public static final int UNKNOWN_POSITION = -1;

    private final ErrorKind kind;
    private final int position;

    /**
     * Constructor with an error kind and an explanatory message.
     *
     * @param kind    the rule broken by the expression
     * @param message the message describing the cause, should name the offending term
     */
    public DiceSyntaxException(ErrorKind kind, String message) {
        this(kind, UNKNOWN_POSITION, message, null);
    }

    /**
     * Constructor with an error kind, the position of the offending token and a message.
     *
     * @param kind     the rule broken by the expression
     * @param position zero-based character position of the offending token in the raw input
     * @param message  the message describing the cause
     */
    public DiceSyntaxException(ErrorKind kind, int position, String message) {
        this(kind, position, message, null);
    }

    /**
     * Constructor with an error kind, an explanatory message and an underlying cause.
     * <p>
     * Used when the failure comes from a lower-level conversion, such as a digit run
     * too large for an {@code int}.
     * </p>
     *
     * @param kind     the rule broken by the expression
     * @param position zero-based character position, or {@link #UNKNOWN_POSITION}
     * @param message  the message describing the cause
     * @param cause    the original cause of this exception
     */
    public DiceSyntaxException(ErrorKind kind, int position, String message, Throwable cause) {
        super(message, cause);
        if (kind == null) {
            throw new IllegalArgumentException("Error kind is required");
        }
        this.kind = kind;
        this.position = position;
    }

    /**
     * Gets the rule broken by the expression.
     *
     * @return the error kind, never null
     */
    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Gets the zero-based position of the offending token in the raw input.
     *
     * @return the position, or {@link #UNKNOWN_POSITION}
     */
    public int getPosition() {
        return position;
    }

    /**
     * Kinds of malformed roll expressions.
     */
    public enum ErrorKind {
        /** An operator sits at a sequence boundary or has no operand on one side. */
        MALFORMED_OPERATOR_PLACEMENT,
        /** Several terms remain with no connecting operator, or none remains where one is required. */
        AMBIGUOUS_OR_MISSING_OPERAND,
        /** An operand contains {@code d} but is not a well-formed die term. */
        MALFORMED_DIE_TERM,
        /** A non-die operand does not parse as an integer. */
        INVALID_LITERAL,
        /**
         * The expression exceeds a limit of the active {@link io.github.cyfko.diceql.core.config.DicePolicy},
         * or a total does not fit in an {@code int}.
         */
        LIMIT_EXCEEDED
    }
}
