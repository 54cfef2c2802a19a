package dev.ebullient.rpgdm.model;

/** One additive term of a dice expression: a group of dice or a signed constant. */
public sealed interface DiceTerm permits RollTerm, ModifierTerm {

    /** Render this term without a leading sign. */
    String toNotation();
}
