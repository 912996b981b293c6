package com.example.pokebattle.util;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Unseeded production source.
 */
public final class ThreadLocalRandomSource implements RandomSource {

    public static final ThreadLocalRandomSource INSTANCE = new ThreadLocalRandomSource();

    private ThreadLocalRandomSource() { }

    @Override
    public double nextDouble() {
        return ThreadLocalRandom.current().nextDouble();
    }
}
