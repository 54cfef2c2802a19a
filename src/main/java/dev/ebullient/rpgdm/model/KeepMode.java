package dev.ebullient.rpgdm.model;

public enum KeepMode {
    HIGHEST("kh", "highest"),
    LOWEST("kl", "lowest");

    private final String suffix;
    private final String display;

    KeepMode(String suffix, String display) {
        this.suffix = suffix;
        this.display = display;
    }

    /** Notation suffix: {@code kh} or {@code kl} */
    public String suffix() {
        return suffix;
    }

    public String display() {
        return display;
    }
}
