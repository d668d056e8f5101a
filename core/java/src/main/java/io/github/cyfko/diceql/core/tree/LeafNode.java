package io.github.cyfko.diceql.core.tree;

import io.github.cyfko.diceql.core.api.DieRoller;
import io.github.cyfko.diceql.core.api.ExpressionNode;
import io.github.cyfko.diceql.core.config.DiceReservedSymbol;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Leaf of an expression tree: a single die roll or an integer literal.
 * <p>
 * The value is fixed at construction. A die leaf is rolled exactly once through the
 * supplied {@link DieRoller}; rendering reads the stored value and never rolls again.
 * </p>
 *
 * @since 1.0.0
 */
public final class LeafNode implements ExpressionNode {

    private final String term;
    private final boolean die;
    private final int faceCount;
    private final int value;

    private LeafNode(String term, boolean die, int faceCount, int value) {
        this.term = Objects.requireNonNull(term, "term cannot be null");
        this.die = die;
        this.faceCount = faceCount;
        this.value = value;
    }

    /**
     * Creates a literal leaf.
     *
     * @param term  the term as written in the expression
     * @param value the parsed integer
     * @return the literal leaf
     */
    public static LeafNode literal(String term, int value) {
        return new LeafNode(term, false, 0, value);
    }

    /**
     * Creates a die leaf by rolling a single die.
     *
     * @param term   the term as written, e.g. {@code "d20"} or {@code "1d6"}
     * @param faces  the face count, at least 1
     * @param roller the random source
     * @return the rolled die leaf
     * @throws IllegalArgumentException if {@code faces} is not positive
     * @throws IllegalStateException    if the roller returns a value outside {@code [1, faces]}
     */
    public static LeafNode roll(String term, int faces, DieRoller roller) {
        Objects.requireNonNull(roller, "roller cannot be null");
        if (faces <= 0) {
            throw new IllegalArgumentException("faces must be positive, got: " + faces);
        }
        int rolled = roller.roll(faces);
        if (rolled < 1 || rolled > faces) {
            throw new IllegalStateException(String.format(
                    "Die roller returned %d for a d%d (expected a value in [1, %d])", rolled, faces, faces));
        }
        return new LeafNode(term, true, faces, rolled);
    }

    /**
     * @return the term string this leaf was created from
     */
    public String getTerm() {
        return term;
    }

    public boolean isDie() {
        return die;
    }

    /**
     * @return the face count of a die leaf, empty for a literal
     */
    public OptionalInt getFaceCount() {
        return die ? OptionalInt.of(faceCount) : OptionalInt.empty();
    }

    /**
     * @return true for a die that rolled its face count
     */
    public boolean isNaturalMaximum() {
        return die && value == faceCount;
    }

    @Override
    public int value() {
        return value;
    }

    @Override
    public String render() {
        if (!die) {
            return Integer.toString(value);
        }
        String face = "(" + DiceReservedSymbol.DIE + faceCount + ")";
        if (isNaturalMaximum()) {
            return DiceReservedSymbol.NATURAL_MAX_OPEN + value + DiceReservedSymbol.NATURAL_MAX_CLOSE + face;
        }
        return value + face;
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public String toString() {
        return die
                ? "LeafNode[" + value + ", " + DiceReservedSymbol.DIE + faceCount + "]"
                : "LeafNode[" + value + "]";
    }
}
