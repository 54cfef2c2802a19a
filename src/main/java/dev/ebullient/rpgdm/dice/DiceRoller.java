package dev.ebullient.rpgdm.dice;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import dev.ebullient.rpgdm.model.DiceSpec;
import dev.ebullient.rpgdm.model.DiceTerm;
import dev.ebullient.rpgdm.model.Keep;
import dev.ebullient.rpgdm.model.KeepMode;
import dev.ebullient.rpgdm.model.ModifierTerm;
import dev.ebullient.rpgdm.model.RollResult;
import dev.ebullient.rpgdm.model.RollTerm;
import dev.ebullient.rpgdm.model.TermRoll;

/**
 * Evaluates a {@link DiceSpec} against a {@link RandomSource}.
 * Stateless apart from the clock used to timestamp results.
 */
public class DiceRoller {

    private final Clock clock;

    public DiceRoller() {
        this(Clock.systemUTC());
    }

    public DiceRoller(Clock clock) {
        this.clock = clock;
    }

    /**
     * Roll the expression once. Any repeat count is ignored; see {@link #rollAll}.
     */
    public RollResult roll(DiceSpec spec, RandomSource rng) {
        List<TermRoll> termRolls = new ArrayList<>();
        int total = 0;
        for (DiceTerm term : spec.effectiveTerms()) {
            TermRoll termRoll = term instanceof RollTerm roll
                    ? rollTerm(roll, rng)
                    : TermRoll.modifier((ModifierTerm) term);
            termRolls.add(termRoll);
            total = Math.addExact(total, termRoll.subtotal());
        }
        return new RollResult(spec, termRolls, total, rng.seed(), clock.instant());
    }

    /**
     * Roll the expression {@code spec.repeat()} times, each independently.
     */
    public List<RollResult> rollAll(DiceSpec spec, RandomSource rng) {
        List<RollResult> results = new ArrayList<>(spec.repeat());
        for (int i = 0; i < spec.repeat(); i++) {
            results.add(roll(spec, rng));
        }
        return results;
    }

    TermRoll rollTerm(RollTerm term, RandomSource rng) {
        List<Integer> raw = new ArrayList<>(term.count());
        for (int i = 0; i < term.count(); i++) {
            raw.add(term.sides() == 1 ? 1 : rng.nextInt(1, term.sides()));
        }
        List<Integer> kept = term.keep()
                .map(keep -> keep(raw, keep))
                .orElse(raw);
        int subtotal = 0;
        for (int value : kept) {
            subtotal = Math.addExact(subtotal, value);
        }
        return new TermRoll(term, raw, kept, subtotal);
    }

    static List<Integer> keep(List<Integer> raw, Keep keep) {
        Comparator<Integer> order = keep.mode() == KeepMode.HIGHEST
                ? Comparator.reverseOrder()
                : Comparator.naturalOrder();
        return raw.stream()
                .sorted(order)
                .limit(keep.count())
                .toList();
    }
}
