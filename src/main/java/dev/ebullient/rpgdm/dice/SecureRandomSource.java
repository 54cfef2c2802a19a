package dev.ebullient.rpgdm.dice;

import java.security.SecureRandom;

/**
 * Random source for live play.
 */
public class SecureRandomSource implements RandomSource {

    private final SecureRandom random = new SecureRandom();

    @Override
    public int nextInt(int low, int highInclusive) {
        if (highInclusive < low) {
            throw new IllegalArgumentException("Empty range [%d, %d]".formatted(low, highInclusive));
        }
        return low + random.nextInt(highInclusive - low + 1);
    }
}
