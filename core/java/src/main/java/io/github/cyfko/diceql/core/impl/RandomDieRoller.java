package io.github.cyfko.diceql.core.impl;

import io.github.cyfko.diceql.core.api.DieRoller;

import java.util.Objects;
import java.util.Random;

/**
 * {@link DieRoller} backed by {@link java.util.Random}.
 * <p>
 * Thread-safe: {@link Random} instances may be shared across threads. Use {@link #seeded(long)}
 * for reproducible sequences.
 * </p>
 *
 * @since 1.0.0
 */
public final class RandomDieRoller implements DieRoller {

    private final Random random;

    /**
     * Creates a roller over a system-seeded {@link Random}.
     */
    public RandomDieRoller() {
        this(new Random());
    }

    /**
     * Creates a roller over the given random source.
     *
     * @param random the random source
     */
    public RandomDieRoller(Random random) {
        this.random = Objects.requireNonNull(random, "random cannot be null");
    }

    /**
     * Creates a roller producing the same sequence for the same seed.
     *
     * @param seed the seed
     * @return the seeded roller
     */
    public static RandomDieRoller seeded(long seed) {
        return new RandomDieRoller(new Random(seed));
    }

    @Override
    public int roll(int faces) {
        if (faces <= 0) {
            throw new IllegalArgumentException("faces must be positive, got: " + faces);
        }
        return 1 + random.nextInt(faces);
    }
}
