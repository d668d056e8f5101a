package io.github.cyfko.diceql.core.api;

/**
 * Source of random die results.
 * <p>
 * Implementations must return a value uniformly distributed over {@code [1, faces]}.
 * Tests inject a scripted roller to make evaluation deterministic; nothing else
 * about seeding is part of the contract.
 * </p>
 *
 * @since 1.0.0
 * @see io.github.cyfko.diceql.core.impl.RandomDieRoller
 */
@FunctionalInterface
public interface DieRoller {

    /**
     * Rolls one die.
     *
     * @param faces the face count of the die, at least 1
     * @return a value in {@code [1, faces]}
     */
    int roll(int faces);
}
