package dev.ebullient.rpgdm;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.EventFilter;

/**
 * Lazy, read-only view over a snapshot of session events. Every call to
 * {@link #iterator()} or {@link #stream()} starts a new pass over the same snapshot.
 */
public class EventQuery implements Iterable<Event> {

    private final List<List<Event>> snapshot;
    private final EventFilter filter;

    EventQuery(List<List<Event>> snapshot, EventFilter filter) {
        this.snapshot = snapshot;
        this.filter = filter;
    }

    public Stream<Event> stream() {
        return snapshot.stream()
                .flatMap(List::stream)
                .filter(filter::matches);
    }

    @Override
    public Iterator<Event> iterator() {
        return stream().iterator();
    }

    public List<Event> toList() {
        return stream().toList();
    }
}
