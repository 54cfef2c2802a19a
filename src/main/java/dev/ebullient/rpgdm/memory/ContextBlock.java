package dev.ebullient.rpgdm.memory;

import dev.ebullient.rpgdm.model.Event;

/**
 * One entry of a context package: either an event or a scene summary.
 *
 * @param event the event, or null for a summary block
 * @param text rendered text; this is what the budget is charged for
 */
public record ContextBlock(
        ContextLayer layer,
        String sceneId,
        String sceneTitle,
        String location,
        Event event,
        String text,
        int size) {

    public boolean isSummary() {
        return event == null;
    }
}
