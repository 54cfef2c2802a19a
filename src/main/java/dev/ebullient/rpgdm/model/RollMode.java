package dev.ebullient.rpgdm.model;

/**
 * Advantage and disadvantage are sugar for rolling the die twice and keeping
 * one of the two results.
 */
public enum RollMode {
    NORMAL("", null),
    ADVANTAGE("adv", KeepMode.HIGHEST),
    DISADVANTAGE("dis", KeepMode.LOWEST);

    private final String suffix;
    private final KeepMode keepMode;

    RollMode(String suffix, KeepMode keepMode) {
        this.suffix = suffix;
        this.keepMode = keepMode;
    }

    public String suffix() {
        return suffix;
    }

    /** Which die of the pair is kept; null for {@link #NORMAL}. */
    public KeepMode keepMode() {
        return keepMode;
    }
}
