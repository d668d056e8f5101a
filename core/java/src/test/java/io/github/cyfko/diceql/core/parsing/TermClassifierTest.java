package io.github.cyfko.diceql.core.parsing;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.config.DicePolicy;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException;
import io.github.cyfko.diceql.core.exception.DiceSyntaxException.ErrorKind;
import io.github.cyfko.diceql.core.model.Field;
import io.github.cyfko.diceql.core.model.Term;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test suite for {@link TermClassifier}.
 */
@DisplayName("TermClassifier Tests")
class TermClassifierTest {

    private static Term operand(String text) {
        return TermClassifier.classifyOperand(Field.operand(text, 0));
    }

    private static ErrorKind failure(String text) {
        return assertThrows(DiceSyntaxException.class, () -> operand(text)).getKind();
    }

    @Nested
    @DisplayName("Die Terms")
    class DieTerms {

        @ParameterizedTest
        @CsvSource({
                "3d6,   3, 6",
                "d20,   1, 20",
                "1d4,   1, 4",
                "10d10, 10, 10",
                "007d8, 7, 8"
        })
        @DisplayName("Multiplier and face count")
        void testDieNotation(String text, int multiplier, int faces) {
            Term term = operand(text);

            assertTrue(term.isDie());
            assertEquals(multiplier, term.getMultiplier());
            assertEquals(faces, term.getFaces());
            assertEquals(text, term.getText());
        }

        @Test
        @DisplayName("Only multipliers above one are multi-die")
        void testMultiDie() {
            assertTrue(operand("2d6").isMultiDie());
            assertFalse(operand("1d6").isMultiDie());
            assertFalse(operand("d6").isMultiDie());
        }

        @ParameterizedTest
        @ValueSource(strings = {"d", "3d", "dd6", "2dx"})
        @DisplayName("'d' without a face count")
        void testNoFaceCount(String text) {
            DiceSyntaxException e = assertThrows(DiceSyntaxException.class, () -> operand(text));
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, e.getKind());
            assertTrue(e.getMessage().contains("no face count"), e.getMessage());
        }

        @ParameterizedTest
        @ValueSource(strings = {"-d6", "2d6x", "x2d6", "2d6d6", "2 d6", "2d 6"})
        @DisplayName("Characters around the die notation")
        void testExtraCharacters(String text) {
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, failure(text));
        }

        @Test
        @DisplayName("Zero dice or zero faces")
        void testZeroCounts() {
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, failure("0d6"));
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, failure("2d0"));
        }

        @Test
        @DisplayName("Counts too large for an int")
        void testOverflow() {
            DiceSyntaxException e = assertThrows(DiceSyntaxException.class, () -> operand("99999999999d6"));
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, e.getKind());
            assertInstanceOf(NumberFormatException.class, e.getCause());
            assertEquals(ErrorKind.MALFORMED_DIE_TERM, failure("1d99999999999"));
        }
    }

    @Nested
    @DisplayName("Literal Terms")
    class LiteralTerms {

        @ParameterizedTest
        @CsvSource({"4, 4", "-3, -3", "0, 0", "2147483647, 2147483647"})
        @DisplayName("Signed integers")
        void testLiteral(String text, int value) {
            Term term = operand(text);
            assertEquals(Term.Kind.LITERAL, term.getKind());
            assertEquals(value, term.getLiteral());
        }

        @ParameterizedTest
        @ValueSource(strings = {"3x", "abc", "5 3", "1.5", "2147483648", "--3"})
        @DisplayName("Not an integer")
        void testInvalidLiteral(String text) {
            assertEquals(ErrorKind.INVALID_LITERAL, failure(text));
        }

        @Test
        @DisplayName("Empty operand is a misplaced operator")
        void testEmptyOperand() {
            assertEquals(ErrorKind.MALFORMED_OPERATOR_PLACEMENT, failure(""));
        }

        @Test
        @DisplayName("Literal terms have no die data")
        void testKindMismatch() {
            Term term = operand("4");
            assertThrows(UnsupportedOperationException.class, term::getFaces);
            assertThrows(UnsupportedOperationException.class, term::getOperator);
        }
    }

    @Nested
    @DisplayName("Sequence Classification")
    class SequenceClassification {

        @Test
        @DisplayName("Operators and operands keep their order")
        void testSequence() {
            List<Field> fields = FieldSplitter.split("2d6+3-1d4", DicePolicy.defaults());
            List<Term> terms = TermClassifier.classify(fields, DicePolicy.defaults());

            assertEquals(5, terms.size());
            assertTrue(terms.get(0).isMultiDie());
            assertEquals(ArithmeticOp.ADD, terms.get(1).getOperator());
            assertEquals(3, terms.get(2).getLiteral());
            assertEquals(ArithmeticOp.SUB, terms.get(3).getOperator());
            assertEquals(4, terms.get(4).getFaces());
        }

        @Test
        @DisplayName("Dice count adds up across terms")
        void testDiceCountLimit() {
            DicePolicy policy = DicePolicy.builder().maxDiceCount(5).build();
            List<Field> withinLimit = FieldSplitter.split("3d6+2d4", policy);
            List<Field> overLimit = FieldSplitter.split("3d6+2d4+d8", policy);

            assertEquals(5, TermClassifier.classify(withinLimit, policy).size());
            DiceSyntaxException e = assertThrows(DiceSyntaxException.class,
                    () -> TermClassifier.classify(overLimit, policy));
            assertEquals(ErrorKind.LIMIT_EXCEEDED, e.getKind());
        }

        @Test
        @DisplayName("Face count limit")
        void testFaceLimit() {
            List<Field> fields = FieldSplitter.split("1d1001", DicePolicy.strict());

            DiceSyntaxException e = assertThrows(DiceSyntaxException.class,
                    () -> TermClassifier.classify(fields, DicePolicy.strict()));
            assertEquals(ErrorKind.LIMIT_EXCEEDED, e.getKind());
            assertTrue(e.getMessage().contains("STRICT_POLICY"));
        }
    }
}
