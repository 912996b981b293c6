package com.example.pokebattle.util;

/**
 * Source of every random outcome in a battle: accuracy, critical hits, status chances,
 * paralysis/confusion/thaw rolls and status durations. Simulations take one of these
 * so a seeded or scripted source reproduces an identical log.
 */
@FunctionalInterface
public interface RandomSource {

    /**
     * @return a uniform value in [0.0, 1.0)
     */
    double nextDouble();

    /**
     * Roll against a probability.
     *
     * @param probability chance of success, 0.0-1.0
     * @return true with the given probability
     */
    default boolean chance(double probability) {
        return nextDouble() < probability;
    }

    /**
     * Uniform integer in [minInclusive, maxInclusive], consuming one draw.
     */
    default int nextIntInclusive(int minInclusive, int maxInclusive) {
        if (maxInclusive < minInclusive) {
            throw new IllegalArgumentException("max < min");
        }
        int span = maxInclusive - minInclusive + 1;
        int offset = (int) (nextDouble() * span);
        return minInclusive + Math.min(offset, span - 1);
    }
}
