package io.github.cyfko.diceql.core.config;

/**
 * Reserved symbolic constants used when splitting and rendering roll expressions.
 *
 * @since 1.0.0
 */
public final class DiceReservedSymbol {

    private DiceReservedSymbol() {}

    /** Addition operator symbol. */
    public static final String PLUS = "+";

    /** Subtraction operator symbol. Doubles as the sign of a negative literal. */
    public static final String MINUS = "-";

    /** Separator between the multiplier and the face count of a die term. */
    public static final char DIE = 'd';

    /** Opening marker placed around a natural maximum roll. */
    public static final String NATURAL_MAX_OPEN = "!*";

    /** Closing marker placed around a natural maximum roll. */
    public static final String NATURAL_MAX_CLOSE = "*!";
}
