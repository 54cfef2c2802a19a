package dev.ebullient.rpgdm.dice;

import java.util.OptionalLong;

/**
 * Source of uniformly distributed integers for the {@link DiceRoller}.
 */
public interface RandomSource {

    /**
     * @return a uniformly distributed integer in {@code [low, highInclusive]}
     */
    int nextInt(int low, int highInclusive);

    /** The seed this source was created with, when it is reproducible. */
    default OptionalLong seed() {
        return OptionalLong.empty();
    }
}
