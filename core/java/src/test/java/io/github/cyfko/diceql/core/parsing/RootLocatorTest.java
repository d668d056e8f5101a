package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link RootLocator}.
 */
@DisplayName("RootLocator Tests")
class RootLocatorTest {

    private static final Term ONE = Term.literal("1", 0, 1);
    private static final Term TWO = Term.literal("2", 0, 2);
    private static final Term PLUS = Term.operator(ArithmeticOp.ADD, 0);
    private static final Term MINUS = Term.operator(ArithmeticOp.SUB, 0);

    @Test
    @DisplayName("Single term is its own root")
    void testSingleTerm() {
        assertEquals(0, RootLocator.findRoot(List.of(ONE), 0, 1));
    }

    @Test
    @DisplayName("First '+' when there is no '-'")
    void testFirstPlus() {
        List<Term> terms = List.of(ONE, PLUS, TWO, PLUS, ONE);
        assertEquals(1, RootLocator.findRoot(terms, 0, terms.size()));
    }

    @Test
    @DisplayName("Last '-' wins over any '+'")
    void testLastMinus() {
        List<Term> terms = List.of(ONE, MINUS, TWO, PLUS, ONE, MINUS, TWO, PLUS, ONE);
        assertEquals(5, RootLocator.findRoot(terms, 0, terms.size()));
    }

    @Test
    @DisplayName("Only the given range is searched")
    void testSubRange() {
        List<Term> terms = List.of(ONE, MINUS, TWO, PLUS, ONE);
        assertEquals(3, RootLocator.findRoot(terms, 2, 5));
        assertEquals(4, RootLocator.findRoot(terms, 4, 5));
    }

    @Test
    @DisplayName("Several terms without an operator")
    void testNoOperator() {
        DiceSyntaxException e = assertThrows(DiceSyntaxException.class,
                () -> RootLocator.findRoot(List.of(ONE, TWO), 0, 2));
        assertEquals(ErrorKind.AMBIGUOUS_OR_MISSING_OPERAND, e.getKind());
    }

    @Test
    @DisplayName("Empty range")
    void testEmptyRange() {
        DiceSyntaxException e = assertThrows(DiceSyntaxException.class,
                () -> RootLocator.findRoot(List.of(ONE), 1, 1));
        assertEquals(ErrorKind.AMBIGUOUS_OR_MISSING_OPERAND, e.getKind());
    }

    @Test
    @DisplayName("Range outside the sequence")
    void testInvalidRange() {
        assertThrows(IndexOutOfBoundsException.class, () -> RootLocator.findRoot(List.of(ONE), 0, 2));
    }
}
