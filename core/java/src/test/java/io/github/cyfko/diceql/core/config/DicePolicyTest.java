package io.github.cyfko.diceql.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DicePolicy Tests")
class DicePolicyTest {

    @Nested
    @DisplayName("Presets")
    class Presets {

        @Test
        @DisplayName("Default limits")
        void testDefaults() {
            DicePolicy policy = DicePolicy.defaults();

            assertEquals("DEFAULT_POLICY", policy.policyName());
            assertEquals(1000, policy.maxExpressionLength());
            assertEquals(1000, policy.maxDiceCount());
            assertEquals(1_000_000, policy.maxFaceCount());
        }

        @Test
        @DisplayName("Strict is tighter than default, relaxed is looser")
        void testOrdering() {
            DicePolicy strict = DicePolicy.strict();
            DicePolicy defaults = DicePolicy.defaults();
            DicePolicy relaxed = DicePolicy.relaxed();

            assertTrue(strict.maxExpressionLength() < defaults.maxExpressionLength());
            assertTrue(strict.maxDiceCount() < defaults.maxDiceCount());
            assertTrue(relaxed.maxDiceCount() > defaults.maxDiceCount());
            assertEquals(Integer.MAX_VALUE, relaxed.maxFaceCount());
        }

        @ParameterizedTest
        @ValueSource(strings = {"strict", "STRICT", " Strict ", "STRICT_POLICY"})
        @DisplayName("Resolved by name")
        void testNamed(String name) {
            assertEquals(DicePolicy.strict(), DicePolicy.named(name));
        }

        @Test
        @DisplayName("Unknown name")
        void testUnknownName() {
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.named("paranoid"));
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.named(" "));
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.named(null));
        }
    }

    @Nested
    @DisplayName("Builder and Validation")
    class BuilderAndValidation {

        @Test
        @DisplayName("Builder starts from default limits")
        void testBuilderDefaults() {
            DicePolicy policy = DicePolicy.builder().maxDiceCount(10).build();

            assertEquals("CUSTOM_POLICY", policy.policyName());
            assertEquals(10, policy.maxDiceCount());
            assertEquals(DicePolicy.defaults().maxExpressionLength(), policy.maxExpressionLength());
            assertEquals(DicePolicy.defaults().maxFaceCount(), policy.maxFaceCount());
        }

        @Test
        @DisplayName("Limits must be positive")
        void testNonPositiveLimits() {
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.builder().maxExpressionLength(0).build());
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.builder().maxDiceCount(-1).build());
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.builder().maxFaceCount(0).build());
        }

        @Test
        @DisplayName("Name is required")
        void testBlankName() {
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.builder().policyName("").build());
            assertThrows(IllegalArgumentException.class, () -> DicePolicy.builder().policyName(null).build());
        }
    }
}
