package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Term;

import java.util.List;

/**
 * Locates the term that becomes the root of the subtree built from a range of terms.
 * <p>
 * Precedence, evaluated over the half-open range {@code [from, to)}:
 * </p>
 * <ol>
 *   <li>the <strong>last</strong> {@code '-'} operator, if any</li>
 *   <li>otherwise the <strong>first</strong> {@code '+'} operator, if any</li>
 *   <li>otherwise the single term of the range</li>
 * </ol>
 *
 * @since 1.0.0
 */
public final class RootLocator {

    private RootLocator() {}

    /**
     * Finds the root index of a term range.
     *
     * @param terms the full term sequence
     * @param from  first index of the range, inclusive
     * @param to    last index of the range, exclusive
     * @return the index of the root term, within {@code [from, to)}
     * @throws DiceSyntaxException with {@link ErrorKind#AMBIGUOUS_OR_MISSING_OPERAND} if the range is
     *                             empty, or holds several terms and no operator
     */
    public static int findRoot(List<Term> terms, int from, int to) {
        if (from < 0 || to > terms.size() || from > to) {
            throw new IndexOutOfBoundsException("Invalid term range [" + from + ", " + to + ") of " + terms.size());
        }
        if (from == to) {
            throw new DiceSyntaxException(ErrorKind.AMBIGUOUS_OR_MISSING_OPERAND,
                    "Missing operand: no term left where one is required");
        }

        int lastMinus = -1;
        int firstPlus = -1;
        for (int i = from; i < to; i++) {
            Term term = terms.get(i);
            if (!term.isOperator()) continue;
            if (term.getOperator() == ArithmeticOp.SUB) {
                lastMinus = i;
            } else if (firstPlus < 0) {
                firstPlus = i;
            }
        }

        if (lastMinus >= 0) return lastMinus;
        if (firstPlus >= 0) return firstPlus;

        if (to - from != 1) {
            Term first = terms.get(from);
            throw new DiceSyntaxException(ErrorKind.AMBIGUOUS_OR_MISSING_OPERAND, first.getPosition(), String.format(
                    "No operator between %d terms starting at '%s' (position %d)",
                    to - from, first.getText(), first.getPosition()));
        }
        return from;
    }
}
