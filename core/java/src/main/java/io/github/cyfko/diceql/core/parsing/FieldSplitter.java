package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.config.DicePolicy;
import io.github.cyfko.diceql.core.config.DiceReservedSymbol;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Field;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Splits a raw roll expression into a flat sequence of operand and operator {@link Field}s.
 * <p>
 * The scan is a single left-to-right pass accumulating operand characters in a buffer:
 * </p>
 * <ul>
 *   <li>{@code '+'} or {@code '-'}: the trimmed buffer becomes an operand field, followed by the operator field</li>
 *   <li>{@code '-'} right after a {@code '-'} operator, with nothing in between: sign of the next literal</li>
 *   <li>anything else: appended to the buffer</li>
 * </ul>
 * <p>
 * Operand contents are not inspected here; classification happens in {@link TermClassifier}.
 * </p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * List<Field> fields = FieldSplitter.split("2d6 + 3 - -1", DicePolicy.defaults());
 * // Result: ["2d6", "+", "3", "-", "-1"]
 * }</pre>
 *
 * <h2>Rejected Input</h2>
 * <ul>
 *   <li>Blank expression: {@link ErrorKind#AMBIGUOUS_OR_MISSING_OPERAND}</li>
 *   <li>Expression longer than {@link DicePolicy#maxExpressionLength()}: {@link ErrorKind#LIMIT_EXCEEDED}</li>
 *   <li>Operator with nothing on its left ({@code "+5"}, {@code "5++3"}), or a third consecutive
 *       {@code '-'}: {@link ErrorKind#MALFORMED_OPERATOR_PLACEMENT}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class FieldSplitter {

    private FieldSplitter() {}

    /**
     * Splits an expression into fields.
     *
     * @param expression the raw expression
     * @param dicePolicy limits to enforce
     * @return an unmodifiable list of fields in insertion order
     * @throws DiceSyntaxException if the expression is blank, too long or has a misplaced operator
     */
    public static List<Field> split(String expression, DicePolicy dicePolicy) {
        if (expression == null || expression.isBlank()) {
            throw new DiceSyntaxException(ErrorKind.AMBIGUOUS_OR_MISSING_OPERAND,
                    "Roll expression cannot be null or empty");
        }
        if (dicePolicy == null) {
            throw new NullPointerException("dicePolicy cannot be null");
        }

        int length = expression.trim().length();
        if (length > dicePolicy.maxExpressionLength()) {
            throw new DiceSyntaxException(ErrorKind.LIMIT_EXCEEDED, String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    length, dicePolicy.maxExpressionLength(), dicePolicy.policyName()
            ));
        }

        return Collections.unmodifiableList(scan(expression));
    }

    private static List<Field> scan(String expression) {
        List<Field> fields = new ArrayList<>();
        StringBuilder buffer = new StringBuilder();
        int operandStart = -1;
        int signPosition = -1;

        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);

            if (!ArithmeticOp.isOperatorChar(c)) {
                if (operandStart < 0 && !Character.isWhitespace(c)) {
                    operandStart = i;
                }
                buffer.append(c);
                continue;
            }

            boolean blank = buffer.toString().isBlank();
            boolean afterMinus = !fields.isEmpty() && fields.get(fields.size() - 1).isMinus();

            if (c == '-' && blank && afterMinus) {
                if (signPosition >= 0) {
                    throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, i, String.format(
                            "Unexpected '-' at position %d: a subtraction may be followed by one sign only", i));
                }
                signPosition = i;
                continue;
            }

            if (blank && signPosition < 0) {
                throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, i, String.format(
                        "Operator '%c' at position %d has no left operand", c, i));
            }

            fields.add(operand(buffer, operandStart, signPosition));
            fields.add(Field.operator(String.valueOf(c), i));
            buffer.setLength(0);
            operandStart = -1;
            signPosition = -1;
        }

        if (signPosition >= 0 || !buffer.toString().isBlank()) {
            fields.add(operand(buffer, operandStart, signPosition));
        }

        return fields;
    }

    private static Field operand(StringBuilder buffer, int operandStart, int signPosition) {
        String text = buffer.toString().trim();
        if (signPosition < 0) {
            return Field.operand(text, operandStart);
        }
        if (text.isEmpty()) {
            throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, signPosition, String.format(
                    "Operator '-' at position %d has no right operand", signPosition));
        }
        return Field.operand(DiceReservedSymbol.MINUS + text, signPosition);
    }
}
