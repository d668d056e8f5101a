package io.github.cyfko.diceql.core.api;

import io.github.cyfko.diceql.core.config.DiceReservedSymbol;

/**
 * Arithmetic operators supported between the terms of a roll expression.
 * <p>
 * Only additive operators exist. Each constant carries the symbol used both when
 * splitting raw input and when rendering an evaluated tree.
 * </p>
 *
 * @since 1.0.0
 */
public enum ArithmeticOp {

    /** Addition operator: "+" */
    ADD(DiceReservedSymbol.PLUS),

    /** Subtraction operator: "-" */
    SUB(DiceReservedSymbol.MINUS);

    private final String symbol;

    ArithmeticOp(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Gets the symbol of this operator as it appears in expressions.
     *
     * @return the operator symbol
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Applies this operator to two operand values.
     *
     * @param left  the left operand value
     * @param right the right operand value
     * @return {@code left + right} or {@code left - right}
     * @throws ArithmeticException if the result does not fit in an {@code int}
     */
    public int apply(int left, int right) {
        return switch (this) {
            case ADD -> Math.addExact(left, right);
            case SUB -> Math.subtractExact(left, right);
        };
    }

    /**
     * Resolves an operator from its symbol.
     *
     * @param symbol the operator symbol, {@code "+"} or {@code "-"}
     * @return the matching operator
     * @throws IllegalArgumentException if the symbol is not an arithmetic operator
     */
    public static ArithmeticOp fromSymbol(String symbol) {
        for (ArithmeticOp op : values()) {
            if (op.symbol.equals(symbol)) return op;
        }
        throw new IllegalArgumentException("Unknown arithmetic operator: " + symbol);
    }

    /**
     * Checks whether a character is one of the operator symbols.
     *
     * @param c the character to test
     * @return true for {@code '+'} and {@code '-'}
     */
    public static boolean isOperatorChar(char c) {
        return c == '+' || c == '-';
    }
}
