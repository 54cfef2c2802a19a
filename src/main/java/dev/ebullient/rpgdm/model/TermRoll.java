package dev.ebullient.rpgdm.model;

import java.util.List;

/**
 * The dice drawn for one term. Modifier terms have no raw or kept values and
 * their subtotal is the modifier itself.
 */
public record TermRoll(DiceTerm term, List<Integer> raw, List<Integer> kept, int subtotal) {

    public TermRoll {
        raw = List.copyOf(raw);
        kept = List.copyOf(kept);
    }

    public static TermRoll modifier(ModifierTerm term) {
        return new TermRoll(term, List.of(), List.of(), term.value());
    }

    public boolean isRoll() {
        return term instanceof RollTerm;
    }
}
