package com.humanizer.infrastructure.rewrite;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Random;

/**
 * Random whose nextDouble() replays a script, then repeats a fallback. nextInt(bound) always picks 0.
 */
public class ScriptedRandom extends Random {

    private final Deque<Double> script = new ArrayDeque<>();
    private final double fallback;

    public ScriptedRandom(double fallback, double... doubles) {
        this.fallback = fallback;
        for (double d : doubles) {
            script.addLast(d);
        }
    }

    public static ScriptedRandom always(double value) {
        return new ScriptedRandom(value);
    }

    @Override
    public double nextDouble() {
        return script.isEmpty() ? fallback : script.removeFirst();
    }

    @Override
    public int nextInt(int bound) {
        return 0;
    }
}
