package dev.ebullient.rpgdm.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.stream.Collectors;

public record RollResult(
        DiceSpec spec,
        List<TermRoll> termRolls,
        int total,
        OptionalLong seed,
        Instant timestamp) {

    public RollResult {
        Objects.requireNonNull(spec, "spec");
        termRolls = List.copyOf(termRolls);
        seed = seed == null ? OptionalLong.empty() : seed;
        Objects.requireNonNull(timestamp, "timestamp");
    }

    /** Every die drawn, in draw order. */
    public List<Integer> rolls() {
        List<Integer> all = new ArrayList<>();
        for (TermRoll termRoll : termRolls) {
            all.addAll(termRoll.raw());
        }
        return all;
    }

    /** Every die that counted toward the total, in keep order. */
    public List<Integer> kept() {
        List<Integer> all = new ArrayList<>();
        for (TermRoll termRoll : termRolls) {
            all.addAll(termRoll.kept());
        }
        return all;
    }

    public int modifier() {
        return spec.modifierTotal();
    }

    /**
     * Human readable breakdown, e.g.
     * {@code Rolled 4d6: [6, 2, 5, 3], kept highest 3: [6, 5, 3] +2 = 16}
     */
    public String details() {
        StringBuilder sb = new StringBuilder();
        for (TermRoll termRoll : termRolls) {
            if (termRoll.term() instanceof RollTerm roll) {
                if (!sb.isEmpty()) {
                    sb.append("; ");
                }
                sb.append("Rolled ").append(roll.count()).append('d').append(roll.sides())
                        .append(": ").append(format(termRoll.raw()));
                roll.keep().ifPresent(keep -> sb.append(", kept ")
                        .append(keep.mode().display()).append(' ').append(keep.count())
                        .append(": ").append(format(termRoll.kept())));
            }
        }
        int modifier = modifier();
        if (modifier != 0) {
            sb.append(' ').append(modifier > 0 ? "+" : "").append(modifier);
        }
        return sb.append(" = ").append(total).toString();
    }

    public String toJournalEntry() {
        String label = switch (spec.mode()) {
            case ADVANTAGE -> " (advantage)";
            case DISADVANTAGE -> " (disadvantage)";
            case NORMAL -> "";
        };
        return "**Roll** %s%s: %s → **%d**".formatted(spec.toNotation(), label, details(), total);
    }

    private static String format(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", ", "[", "]"));
    }
}
