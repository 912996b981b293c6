package com.example.pokebattle.util;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Test source that replays a fixed sequence of draws. Once the script runs out it
 * either repeats a fallback value or fails, so a test can prove a draw never happened.
 */
public class ScriptedRandomSource implements RandomSource {

    private final Deque<Double> script = new ArrayDeque<>();
    private final Double fallback;
    private int draws;

    private ScriptedRandomSource(Double fallback, double... values) {
        for (double v : values) script.add(v);
        this.fallback = fallback;
    }

    /** Replays exactly these values, then throws. */
    public static ScriptedRandomSource of(double... values) {
        return new ScriptedRandomSource(null, values);
    }

    /** Replays these values, then returns {@code fallback} forever. */
    public static ScriptedRandomSource thenRepeat(double fallback, double... values) {
        return new ScriptedRandomSource(fallback, values);
    }

    @Override
    public double nextDouble() {
        draws++;
        if (!script.isEmpty()) return script.poll();
        if (fallback != null) return fallback;
        throw new IllegalStateException("Random script exhausted after " + (draws - 1) + " draws");
    }

    public int getDraws() {
        return draws;
    }

    public int remaining() {
        return script.size();
    }
}
