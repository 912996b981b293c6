package com.example.pokebattle.util;

import java.util.Random;

/**
 * Deterministic source backed by {@link Random}. Not thread-safe; create one per simulation.
 */
public class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    public long getSeed() {
        return seed;
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
