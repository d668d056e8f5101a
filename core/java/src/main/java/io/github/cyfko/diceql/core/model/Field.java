package io.github.cyfko.diceql.core.model;

import io.github.cyfko.diceql.core.config.DiceReservedSymbol;

import java.util.Objects;

/**
 * Raw token produced by splitting a roll expression: an operator marker or a trimmed operand substring.
 *
 * @param text     the token text, {@code "+"}, {@code "-"} or a trimmed operand (possibly empty)
 * @param position zero-based position of the token in the raw expression
 * @param operator whether this field is an operator marker
 * @since 1.0.0
 */
public record Field(String text, int position, boolean operator) {

    public Field {
        Objects.requireNonNull(text, "text cannot be null");
    }

    /**
     * Creates an operator marker field.
     *
     * @param symbol   {@code "+"} or {@code "-"}
     * @param position position of the operator character
     * @return the operator field
     */
    public static Field operator(String symbol, int position) {
        if (!DiceReservedSymbol.PLUS.equals(symbol) && !DiceReservedSymbol.MINUS.equals(symbol)) {
            throw new IllegalArgumentException("Not an operator symbol: " + symbol);
        }
        return new Field(symbol, position, true);
    }

    /**
     * Creates an operand field from an already trimmed substring.
     *
     * @param text     the trimmed operand
     * @param position position of the first operand character
     * @return the operand field
     */
    public static Field operand(String text, int position) {
        return new Field(text, position, false);
    }

    /**
     * @return true if this is the {@code "-"} operator marker
     */
    public boolean isMinus() {
        return operator && DiceReservedSymbol.MINUS.equals(text);
    }

    @Override
    public String toString() {
        return text;
    }
}
