package dev.ebullient.rpgdm.model;

import java.util.Optional;

public record RollTerm(int count, int sides, Optional<Keep> keep) implements DiceTerm {

    public RollTerm {
        if (count < 1) {
            throw new IllegalArgumentException("Dice count must be at least 1, got " + count);
        }
        if (sides < 1) {
            throw new IllegalArgumentException("Dice must have at least one side, got " + sides);
        }
        keep = keep == null ? Optional.empty() : keep;
        if (keep.isPresent() && keep.get().count() > count) {
            throw new IllegalArgumentException(
                    "Cannot keep %d of %d dice".formatted(keep.get().count(), count));
        }
    }

    public RollTerm(int count, int sides) {
        this(count, sides, Optional.empty());
    }

    public RollTerm(int count, int sides, Keep keep) {
        this(count, sides, Optional.of(keep));
    }

    @Override
    public String toNotation() {
        return count + "d" + sides + keep.map(Keep::toNotation).orElse("");
    }
}
