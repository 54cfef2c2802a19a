package dev.ebullient.rpgdm.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A bounded narrative unit. A scene accepts events from creation until it is ended;
 * ending is terminal.
 */
public class Scene {

    private final String id;
    private final String title;
    private final String location;
    private final Set<String> participants;
    private final Instant startedAt;
    private final List<Event> events;
    private Instant endedAt;
    private String summary;
    private boolean active;

    public Scene(String id, String title, String location, Collection<String> participants, Instant startedAt) {
        this(id, title, location, participants, startedAt, null, null, List.of(), true);
    }

    private Scene(String id, String title, String location, Collection<String> participants,
            Instant startedAt, Instant endedAt, String summary, List<Event> events, boolean active) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title;
        this.location = location;
        this.participants = participants == null ? new LinkedHashSet<>() : new LinkedHashSet<>(participants);
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.endedAt = endedAt;
        this.summary = summary;
        this.events = new ArrayList<>(events);
        this.active = active;
    }

    /**
     * Rebuild a scene read back from storage.
     */
    public static Scene restore(String id, String title, String location, Collection<String> participants,
            Instant startedAt, Instant endedAt, String summary, List<Event> events, boolean active) {
        if (active && endedAt != null) {
            throw new IllegalArgumentException("Scene " + id + " is active but has an end time");
        }
        if (!active && endedAt == null) {
            throw new IllegalArgumentException("Scene " + id + " is ended but has no end time");
        }
        return new Scene(id, title, location, participants, startedAt, endedAt, summary, events, active);
    }

    /**
     * Append an event. The event's actor joins the participants.
     *
     * @throws IllegalStateException if the scene has ended
     */
    public void append(Event event) {
        if (!active) {
            throw new IllegalStateException("Scene " + id + " has ended; events can no longer be added");
        }
        events.add(Objects.requireNonNull(event, "event"));
        if (event.actor() != null) {
            participants.add(event.actor());
        }
    }

    /**
     * End the scene.
     *
     * @throws IllegalStateException if the scene has already ended
     */
    public void end(Instant when, String summary) {
        if (!active) {
            throw new IllegalStateException("Scene " + id + " has already ended");
        }
        this.endedAt = Objects.requireNonNull(when, "when");
        this.summary = summary == null || summary.isBlank() ? null : summary.trim();
        this.active = false;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public String location() {
        return location;
    }

    public Set<String> participants() {
        return Collections.unmodifiableSet(participants);
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Optional<Instant> endedAt() {
        return Optional.ofNullable(endedAt);
    }

    public Optional<String> summary() {
        return Optional.ofNullable(summary);
    }

    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    public int eventCount() {
        return events.size();
    }

    public boolean isActive() {
        return active;
    }

    /** Title for display, falling back to the scene id. */
    public String displayTitle() {
        return title == null || title.isBlank() ? id : title;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Scene other)) {
            return false;
        }
        return active == other.active
                && id.equals(other.id)
                && Objects.equals(title, other.title)
                && Objects.equals(location, other.location)
                && participants.equals(other.participants)
                && startedAt.equals(other.startedAt)
                && Objects.equals(endedAt, other.endedAt)
                && Objects.equals(summary, other.summary)
                && events.equals(other.events);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, title, location, participants, startedAt, endedAt, summary, events, active);
    }

    @Override
    public String toString() {
        return "Scene[%s '%s', %d events%s]".formatted(id, displayTitle(), events.size(), active ? ", active" : "");
    }
}
