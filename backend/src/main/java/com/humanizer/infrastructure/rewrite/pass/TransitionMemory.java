package com.humanizer.infrastructure.rewrite.pass;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The most recently used transition phrases of one rewrite call, oldest evicted first.
 * Not thread-safe; one instance per call.
 */
public class TransitionMemory {

    public static final int DEFAULT_CAPACITY = 3;

    private final int capacity;
    private final Deque<String> recent = new ArrayDeque<>();

    public TransitionMemory() {
        this(DEFAULT_CAPACITY);
    }

    public TransitionMemory(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void record(String phrase) {
        recent.remove(phrase);
        recent.addLast(phrase);
        while (recent.size() > capacity) {
            recent.removeFirst();
        }
    }

    public boolean contains(String phrase) {
        return recent.contains(phrase);
    }

    public List<String> snapshot() {
        return List.copyOf(recent);
    }

    public int size() {
        return recent.size();
    }
}
