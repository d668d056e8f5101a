package io.github.cyfko.diceql.core.model;

import io.github.cyfko.diceql.core.api.ArithmeticOp;
import io.github.cyfko.diceql.core.tree.LeafNode;
import io.github.cyfko.diceql.core.tree.OperationNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RollResult Tests")
class RollResultTest {

    @Test
    @DisplayName("Captures value and rendering of a tree")
    void testOf() {
        OperationNode root = new OperationNode(
                LeafNode.roll("d6", 6, f -> 4), LeafNode.literal("2", 2), ArithmeticOp.ADD);

        RollResult result = RollResult.of(root);

        assertEquals(6, result.total());
        assertEquals("4(d6) + 2", result.rendered());
    }

    @Test
    @DisplayName("Console format")
    void testFormat() {
        assertEquals("!*20*!(d20) - 1 = 19", new RollResult(19, "!*20*!(d20) - 1").format());
    }

    @Test
    @DisplayName("Rendering is required")
    void testNullRendering() {
        assertThrows(NullPointerException.class, () -> new RollResult(1, null));
        assertThrows(NullPointerException.class, () -> RollResult.of(null));
    }
}
