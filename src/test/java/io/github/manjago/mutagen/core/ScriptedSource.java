package io.github.manjago.mutagen.core;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Test source that replays queued values, so each random choice of an operator can be forced.
 */
public class ScriptedSource implements UniformSource {
    
    private final Deque<Double> doubles = new ArrayDeque<>();
    private final Deque<Integer> ints = new ArrayDeque<>();
    
    public ScriptedSource doubles(double... values) {
        for (double v : values) {
            doubles.add(v);
        }
        return this;
    }
    
    public ScriptedSource ints(int... values) {
        for (int v : values) {
            ints.add(v);
        }
        return this;
    }
    
    @Override
    public double nextDouble() {
        if (doubles.isEmpty()) {
            throw new IllegalStateException("No scripted double left");
        }
        return doubles.poll();
    }
    
    @Override
    public int nextInt(int bound) {
        if (ints.isEmpty()) {
            throw new IllegalStateException("No scripted int left (bound " + bound + ")");
        }
        int value = ints.poll();
        if (value < 0 || value >= bound) {
            throw new IllegalStateException("Scripted int " + value + " outside [0, " + bound + ")");
        }
        return value;
    }
    
    public boolean isExhausted() {
        return doubles.isEmpty() && ints.isEmpty();
    }
}
