package dev.ebullient.rpgdm.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A parsed dice expression: ordered terms, an advantage mode and a repeat count.
 * <p>
 * Advantage and disadvantage are kept as a mode so the expression renders the way it
 * was written; {@link #effectiveTerms()} expands them into the equivalent
 * {@code 2dNkh1} / {@code 2dNkl1} roll term, which is what the roller evaluates.
 */
public record DiceSpec(List<DiceTerm> terms, RollMode mode, int repeat) {

    public DiceSpec {
        Objects.requireNonNull(terms, "terms");
        terms = List.copyOf(terms);
        mode = mode == null ? RollMode.NORMAL : mode;
        if (repeat < 1) {
            throw new IllegalArgumentException("Repeat must be at least 1, got " + repeat);
        }
        if (terms.stream().noneMatch(RollTerm.class::isInstance)) {
            throw new IllegalArgumentException("A dice expression needs at least one roll term");
        }
        if (mode != RollMode.NORMAL) {
            List<RollTerm> rolls = rollTerms(terms);
            if (rolls.size() != 1 || rolls.get(0).count() != 1 || rolls.get(0).keep().isPresent()) {
                throw new IllegalArgumentException(mode + " applies to a single die without a keep clause");
            }
        }
        if (maxMagnitude(terms) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Expression total could exceed " + Integer.MAX_VALUE + ": " + terms);
        }
    }

    public DiceSpec(List<DiceTerm> terms) {
        this(terms, RollMode.NORMAL, 1);
    }

    /** Terms as evaluated: advantage/disadvantage become a two-die keep-one roll. */
    public List<DiceTerm> effectiveTerms() {
        if (mode == RollMode.NORMAL) {
            return terms;
        }
        List<DiceTerm> expanded = new ArrayList<>(terms.size());
        for (DiceTerm term : terms) {
            if (term instanceof RollTerm roll) {
                expanded.add(new RollTerm(2, roll.sides(), new Keep(mode.keepMode(), 1)));
            } else {
                expanded.add(term);
            }
        }
        return List.copyOf(expanded);
    }

    /**
     * Largest absolute total the terms can produce, ignoring keep clauses.
     */
    public static long maxMagnitude(List<DiceTerm> terms) {
        long max = 0;
        for (DiceTerm term : terms) {
            if (term instanceof RollTerm roll) {
                max += (long) roll.count() * roll.sides();
            } else if (term instanceof ModifierTerm modifier) {
                max += Math.abs((long) modifier.value());
            }
        }
        return max;
    }

    public int modifierTotal() {
        int total = 0;
        for (DiceTerm term : terms) {
            if (term instanceof ModifierTerm modifier) {
                total += modifier.value();
            }
        }
        return total;
    }

    /**
     * Canonical notation. Parsing the result yields an equal spec.
     */
    public String toNotation() {
        StringBuilder sb = new StringBuilder();
        if (repeat > 1) {
            sb.append(repeat).append('#');
        }
        for (int i = 0; i < terms.size(); i++) {
            DiceTerm term = terms.get(i);
            boolean negative = term instanceof ModifierTerm m && m.value() < 0;
            if (i > 0 || negative) {
                sb.append(negative ? '-' : '+');
            }
            sb.append(term.toNotation());
            if (term instanceof RollTerm) {
                sb.append(mode.suffix());
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toNotation();
    }

    private static List<RollTerm> rollTerms(List<DiceTerm> terms) {
        List<RollTerm> rolls = new ArrayList<>();
        for (DiceTerm term : terms) {
            if (term instanceof RollTerm roll) {
                rolls.add(roll);
            }
        }
        return rolls;
    }
}
