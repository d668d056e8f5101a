package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.config.DicePolicy;
import io.github.cyfko.diceql.core.config.DiceReservedSymbol;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Field;
import io.github.cyfko.diceql.core.model.Term;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Classifies split {@link Field}s into tagged {@link Term}s.
 * <p>
 * Operand recognition:
 * </p>
 * <table border="1">
 * <caption>Operand classification</caption>
 * <tr><th>Operand</th><th>Term</th></tr>
 * <tr><td>{@code "3d6"}</td><td>Die, multiplier 3, 6 faces</td></tr>
 * <tr><td>{@code "d20"}</td><td>Die, multiplier 1, 20 faces</td></tr>
 * <tr><td>{@code "4"}, {@code "-3"}</td><td>Literal</td></tr>
 * <tr><td>{@code "d"}, {@code "3d"}, {@code "2d6x"}, {@code "0d6"}, {@code "1d0"}</td><td>{@link ErrorKind#MALFORMED_DIE_TERM}</td></tr>
 * <tr><td>{@code "3x"}, {@code "abc"}</td><td>{@link ErrorKind#INVALID_LITERAL}</td></tr>
 * </table>
 * <p>
 * All methods are pure functions of their arguments.
 * </p>
 *
 * @since 1.0.0
 */
public final class TermClassifier {

    private TermClassifier() {}

    /**
     * Classifies every field of a split expression and enforces the dice limits of the policy.
     *
     * @param fields     fields produced by {@link FieldSplitter#split(String, DicePolicy)}
     * @param dicePolicy limits on dice count and face count
     * @return an unmodifiable list of terms, one per field, in the same order
     * @throws DiceSyntaxException if an operand is malformed or a limit is exceeded
     */
    public static List<Term> classify(List<Field> fields, DicePolicy dicePolicy) {
        if (fields == null) {
            throw new NullPointerException("fields cannot be null");
        }
        if (dicePolicy == null) {
            throw new NullPointerException("dicePolicy cannot be null");
        }

        List<Term> terms = new ArrayList<>(fields.size());
        long diceCount = 0;

        for (Field field : fields) {
            Term term = field.operator()
                    ? Term.operator(ArithmeticOp.fromSymbol(field.text()), field.position())
                    : classifyOperand(field);

            if (term.isDie()) {
                if (term.getFaces() > dicePolicy.maxFaceCount()) {
                    throw new DiceSyntaxException(ErrorKind.LIMIT_EXCEEDED, term.getPosition(), String.format(
                            "Die '%s' has too many faces (%d, max: %d). Policy applied: %s",
                            term.getText(), term.getFaces(), dicePolicy.maxFaceCount(), dicePolicy.policyName()));
                }
                diceCount += term.getMultiplier();
                if (diceCount > dicePolicy.maxDiceCount()) {
                    throw new DiceSyntaxException(ErrorKind.LIMIT_EXCEEDED, term.getPosition(), String.format(
                            "Too many dice (more than %d). Policy applied: %s",
                            dicePolicy.maxDiceCount(), dicePolicy.policyName()));
                }
            }
            terms.add(term);
        }

        return Collections.unmodifiableList(terms);
    }

    /**
     * Classifies a single operand field as a die or a literal term.
     *
     * @param field an operand field
     * @return the die or literal term
     * @throws DiceSyntaxException if the operand is empty, a malformed die or not an integer
     */
    public static Term classifyOperand(Field field) {
        if (field.operator()) {
            throw new IllegalArgumentException("Not an operand field: " + field.text());
        }
        String text = field.text();
        if (text.isEmpty()) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, field.position(),
                    "Empty operand at position " + field.position());
        }
        return text.indexOf(DiceReservedSymbol.DIE) >= 0
                ? parseDie(text, field.position())
                : parseLiteral(text, field.position());
    }

    /**
     * Parses {@code [multiplier]d<faces>}.
     *
     * @param text     the operand text
     * @param position position of the operand, for error reporting
     * @return the die term
     * @throws DiceSyntaxException with {@link ErrorKind#MALFORMED_DIE_TERM} if the notation is invalid
     */
    public static Term parseDie(String text, int position) {
        int separator = text.indexOf(DiceReservedSymbol.DIE);
        if (separator < 0) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position,
                    String.format("Term '%s' at position %d is not a die", text, position));
        }
        if (separator == text.length() - 1 || !isAsciiDigit(text.charAt(separator + 1))) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position,
                    String.format("Die term '%s' at position %d has no face count", text, position));
        }
        if (!allDigits(text, 0, separator) || !allDigits(text, separator + 1, text.length())) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position, String.format(
                    "Die term '%s' at position %d must look like [multiplier]d<faces>", text, position));
        }

        int multiplier = separator == 0 ? 1 : parseCount(text, 0, separator, "multiplier", position);
        int faces = parseCount(text, separator + 1, text.length(), "face count", position);

        if (multiplier == 0) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position,
                    String.format("Die term '%s' at position %d rolls no dice", text, position));
        }
        if (faces == 0) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position,
                    String.format("Die term '%s' at position %d has no faces", text, position));
        }
        return Term.die(text, position, multiplier, faces);
    }

    /**
     * Parses a signed integer literal.
     *
     * @param text     the operand text
     * @param position position of the operand, for error reporting
     * @return the literal term
     * @throws DiceSyntaxException with {@link ErrorKind#INVALID_LITERAL} if the text is not an {@code int}
     */
    public static Term parseLiteral(String text, int position) {
        try {
            return Term.literal(text, position, Integer.parseInt(text));
        } catch (NumberFormatException e) {
            throw new DiceSyntaxException(ErrorKind.INVALID_LITERAL, position, String.format(
                    "Term '%s' at position %d is neither a die nor an integer", text, position), e);
        }
    }

    private static int parseCount(String text, int from, int to, String what, int position) {
        try {
            return Integer.parseInt(text, from, to, 10);
        } catch (NumberFormatException e) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_DIE_TERM, position, String.format(
                    "Die term '%s' at position %d has an out of range %s", text, position, what), e);
        }
    }

    private static boolean allDigits(String text, int from, int to) {
        for (int i = from; i < to; i++) {
            if (!isAsciiDigit(text.charAt(i))) return false;
        }
        return true;
    }

    private static boolean isAsciiDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
