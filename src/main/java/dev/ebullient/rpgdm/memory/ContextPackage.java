package dev.ebullient.rpgdm.memory;

import java.util.List;
import java.util.Optional;

import dev.ebullient.rpgdm.model.Event;

/**
 * Ordered, bounded slice of session history. Blocks read top to bottom in
 * chronological order: older scene summaries, recent scenes, then the current scene.
 *
 * @param consumed total size of all blocks; may exceed the budget only when
 *        {@link #warning()} is present
 */
public record ContextPackage(
        List<ContextBlock> blocks,
        int consumed,
        TokenBudget budget,
        Optional<BudgetExhaustedWarning> warning) {

    public ContextPackage {
        blocks = List.copyOf(blocks);
        warning = warning == null ? Optional.empty() : warning;
    }

    public List<ContextBlock> blocks(ContextLayer layer) {
        return blocks.stream().filter(b -> b.layer() == layer).toList();
    }

    /** Events included in the package, in order. */
    public List<Event> events() {
        return blocks.stream()
                .filter(b -> !b.isSummary())
                .map(ContextBlock::event)
                .toList();
    }

    public boolean isEmpty() {
        return blocks.isEmpty();
    }

    public int remaining() {
        return Math.max(0, budget.limit() - consumed);
    }
}
