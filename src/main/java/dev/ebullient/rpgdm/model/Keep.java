package dev.ebullient.rpgdm.model;

import java.util.Objects;

public record Keep(KeepMode mode, int count) {

    public Keep {
        Objects.requireNonNull(mode, "mode");
        if (count < 1) {
            throw new IllegalArgumentException("Must keep at least one die, got " + count);
        }
    }

    public static Keep highest(int count) {
        return new Keep(KeepMode.HIGHEST, count);
    }

    public static Keep lowest(int count) {
        return new Keep(KeepMode.LOWEST, count);
    }

    public String toNotation() {
        return mode.suffix() + count;
    }
}
