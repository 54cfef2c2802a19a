package dev.ebullient.rpgdm.model;

public record ModifierTerm(int value) implements DiceTerm {

    @Override
    public String toNotation() {
        return Integer.toString(Math.abs(value));
    }
}
