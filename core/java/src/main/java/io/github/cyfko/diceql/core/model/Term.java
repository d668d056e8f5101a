package io.github.cyfko.diceql.core.model;

import io.github.cyfko.diceql.core.api.ArithmeticOp;

import java.util.Objects;

/**
 * Classified token of a roll expression.
 * <p>
 * A term is exactly one of:
 * </p>
 * <ul>
 *   <li>{@link Kind#OPERATOR}: an {@link ArithmeticOp}</li>
 *   <li>{@link Kind#DIE}: {@code [multiplier]d<faces>}, multiplier defaulting to 1</li>
 *   <li>{@link Kind#LITERAL}: a signed integer</li>
 * </ul>
 * Accessors of another kind's data throw {@link UnsupportedOperationException}.
 *
 * @since 1.0.0
 */
public final class Term {

    public enum Kind {
        OPERATOR,
        DIE,
        LITERAL
    }

    private final Kind kind;
    private final String text;
    private final int position;
    private final ArithmeticOp operator;
    private final int multiplier;
    private final int faces;
    private final int literal;

    private Term(Kind kind, String text, int position, ArithmeticOp operator, int multiplier, int faces, int literal) {
        this.kind = kind;
        this.text = Objects.requireNonNull(text, "text cannot be null");
        this.position = position;
        this.operator = operator;
        this.multiplier = multiplier;
        this.faces = faces;
        this.literal = literal;
    }

    public static Term operator(ArithmeticOp op, int position) {
        Objects.requireNonNull(op, "op cannot be null");
        return new Term(Kind.OPERATOR, op.getSymbol(), position, op, 0, 0, 0);
    }

    public static Term die(String text, int position, int multiplier, int faces) {
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be positive, got: " + multiplier);
        }
        if (faces <= 0) {
            throw new IllegalArgumentException("faces must be positive, got: " + faces);
        }
        return new Term(Kind.DIE, text, position, null, multiplier, faces, 0);
    }

    public static Term literal(String text, int position, int value) {
        return new Term(Kind.LITERAL, text, position, null, 0, 0, value);
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the original text of the term as written in the expression
     */
    public String getText() {
        return text;
    }

    public int getPosition() {
        return position;
    }

    public boolean isOperator() {
        return kind == Kind.OPERATOR;
    }

    public boolean isDie() {
        return kind == Kind.DIE;
    }

    /**
     * @return true for a die term rolling more than one die
     */
    public boolean isMultiDie() {
        return kind == Kind.DIE && multiplier > 1;
    }

    public ArithmeticOp getOperator() {
        if (kind != Kind.OPERATOR)
            throw new UnsupportedOperationException(kind + " term has no operator: " + text);
        return operator;
    }

    public int getMultiplier() {
        if (kind != Kind.DIE)
            throw new UnsupportedOperationException(kind + " term has no multiplier: " + text);
        return multiplier;
    }

    public int getFaces() {
        if (kind != Kind.DIE)
            throw new UnsupportedOperationException(kind + " term has no face count: " + text);
        return faces;
    }

    public int getLiteral() {
        if (kind != Kind.LITERAL)
            throw new UnsupportedOperationException(kind + " term has no literal value: " + text);
        return literal;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Term other)) return false;
        return kind == other.kind
                && position == other.position
                && multiplier == other.multiplier
                && faces == other.faces
                && literal == other.literal
                && operator == other.operator
                && text.equals(other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, text, position, operator, multiplier, faces, literal);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case OPERATOR -> "Operator[" + operator + "]";
            case DIE -> "Die[" + multiplier + "d" + faces + "]";
            case LITERAL -> "Literal[" + literal + "]";
        };
    }
}
