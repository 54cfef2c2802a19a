package dev.ebullient.rpgdm.dice;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Hands out a fixed sequence of values, checking each one fits the requested range.
 */
public class ScriptedRandomSource implements RandomSource {

    private final Deque<Integer> values;

    public ScriptedRandomSource(Integer... values) {
        this.values = new ArrayDeque<>(List.of(values));
    }

    @Override
    public int nextInt(int low, int highInclusive) {
        if (values.isEmpty()) {
            throw new IllegalStateException("No scripted values left");
        }
        int next = values.removeFirst();
        if (next < low || next > highInclusive) {
            throw new IllegalStateException("Scripted value %d outside [%d, %d]".formatted(next, low, highInclusive));
        }
        return next;
    }

    public int remaining() {
        return values.size();
    }
}
