package io.github.cyfko.diceql.core.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RandomDieRoller Tests")
class RandomDieRollerTest {

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 6, 20})
    @DisplayName("Every face is reachable and nothing else")
    void testFaceCoverage(int faces) {
        RandomDieRoller roller = RandomDieRoller.seeded(7L);
        Set<Integer> seen = new HashSet<>();

        for (int i = 0; i < faces * 200; i++) {
            int value = roller.roll(faces);
            assertTrue(value >= 1 && value <= faces, "Out of range: " + value);
            seen.add(value);
        }
        assertEquals(faces, seen.size());
    }

    @Test
    @DisplayName("Seeded rollers repeat the same sequence")
    void testSeeded() {
        RandomDieRoller first = RandomDieRoller.seeded(1234L);
        RandomDieRoller second = new RandomDieRoller(new Random(1234L));

        for (int i = 0; i < 50; i++) {
            assertEquals(first.roll(12), second.roll(12));
        }
    }

    @Test
    @DisplayName("Invalid arguments")
    void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new RandomDieRoller().roll(0));
        assertThrows(NullPointerException.class, () -> new RandomDieRoller(null));
    }
}
