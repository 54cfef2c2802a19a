package dev.ebullient.rpgdm.dice;

import java.util.OptionalLong;
import java.util.Random;

/**
 * Reproducible random source: two instances with the same seed produce the same sequence.
 */
public class SeededRandomSource implements RandomSource {

    private final long seed;
    private final Random random;

    public SeededRandomSource(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public int nextInt(int low, int highInclusive) {
        if (highInclusive < low) {
            throw new IllegalArgumentException("Empty range [%d, %d]".formatted(low, highInclusive));
        }
        return low + random.nextInt(highInclusive - low + 1);
    }

    @Override
    public OptionalLong seed() {
        return OptionalLong.of(seed);
    }
}
