package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.api.DieRoller;
import io.github.cyfko.diceql.core.api.ExpressionNode;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Term;
import io.github.cyfko.diceql.core.tree.LeafNode;
import io.github.cyfko.diceql.core.tree.OperationNode;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds and evaluates an expression tree from classified terms.
 *
 * <h2>Algorithm</h2>
 * <pre>
 * build(from, to):
 *   root = RootLocator.findRoot(terms, from, to)
 *   - operator       : must not sit at either end of the range;
 *                      left = build(from, root), right = build(root + 1, to)
 *   - die, mult &gt; 1 : mult single dice "1d{faces}" joined by '+', nested to the right
 *   - die, mult = 1  : leaf rolled once
 *   - literal        : leaf holding the integer
 * </pre>
 * <p>
 * The builder walks index ranges of one immutable term list and never copies sub-lists.
 * Left subtrees are built before right subtrees, so dice are rolled in the order they are
 * written.
 * </p>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>Operator at the start or end of a range: {@link ErrorKind#MALFORMED_OPERATOR_PLACEMENT}</li>
 *   <li>Empty range, or several terms and no operator: {@link ErrorKind#AMBIGUOUS_OR_MISSING_OPERAND}</li>
 *   <li>Intermediate value outside the {@code int} range: {@link ErrorKind#LIMIT_EXCEEDED}</li>
 * </ul>
 *
 * @since 1.0.0
 * @see RootLocator
 */
public final class ExpressionTreeBuilder {

    private static final Logger log = Logger.getLogger(ExpressionTreeBuilder.class.getName());

    private ExpressionTreeBuilder() {}

    /**
     * Builds the evaluated tree of a complete term sequence.
     *
     * @param terms  terms produced by {@link TermClassifier#classify}
     * @param roller random source for die leaves
     * @return the root of the evaluated tree
     * @throws DiceSyntaxException if the sequence is not a valid alternation of operands and operators,
     *                             or if a total leaves the {@code int} range
     */
    public static ExpressionNode build(List<Term> terms, DieRoller roller) {
        if (terms == null) {
            throw new NullPointerException("terms cannot be null");
        }
        if (roller == null) {
            throw new NullPointerException("roller cannot be null");
        }
        return build(terms, 0, terms.size(), roller);
    }

    private static ExpressionNode build(List<Term> terms, int from, int to, DieRoller roller) {
        int rootIndex = RootLocator.findRoot(terms, from, to);
        Term root = terms.get(rootIndex);

        if (root.isOperator()) {
            if (rootIndex == from) {
                throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, root.getPosition(), String.format(
                        "Operator '%s' at position %d has no left operand", root.getText(), root.getPosition()));
            }
            if (rootIndex == to - 1) {
                throw new DiceSyntaxException(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, root.getPosition(), String.format(
                        "Operator '%s' at position %d has no right operand", root.getText(), root.getPosition()));
            }
            ExpressionNode left = build(terms, from, rootIndex, roller);
            ExpressionNode right = build(terms, rootIndex + 1, to, roller);
            return combine(left, right, root.getOperator(), root);
        }

        if (root.isMultiDie()) {
            return expandDice(root, roller);
        }

        if (root.isDie()) {
            return roll(root.getText(), root.getFaces(), roller);
        }

        return LeafNode.literal(root.getText(), root.getLiteral());
    }

    /**
     * Rewrites {@code NdF} into {@code 1dF + (1dF + (... + 1dF))}, rolling from left to right.
     */
    private static ExpressionNode expandDice(Term die, DieRoller roller) {
        int faces = die.getFaces();
        String single = "1d" + faces;

        List<LeafNode> leaves = new ArrayList<>(die.getMultiplier());
        for (int i = 0; i < die.getMultiplier(); i++) {
            leaves.add(roll(single, faces, roller));
        }

        ExpressionNode node = leaves.get(leaves.size() - 1);
        for (int i = leaves.size() - 2; i >= 0; i--) {
            node = combine(leaves.get(i), node, ArithmeticOp.ADD, die);
        }
        return node;
    }

    private static ExpressionNode combine(ExpressionNode left, ExpressionNode right, ArithmeticOp op, Term origin) {
        try {
            return new OperationNode(left, right, op);
        } catch (ArithmeticException e) {
            throw new DiceSyntaxException(ErrorKind.LIMIT_EXCEEDED, origin.getPosition(), String.format(
                    "'%s' at position %d overflows the integer range (%d %s %d)",
                    origin.getText(), origin.getPosition(), left.value(), op.getSymbol(), right.value()), e);
        }
    }

    private static LeafNode roll(String term, int faces, DieRoller roller) {
        LeafNode leaf = LeafNode.roll(term, faces, roller);
        log.finer(() -> String.format("Rolled %s: %d", term, leaf.value()));
        return leaf;
    }
}
