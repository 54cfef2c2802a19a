package dev.ebullient.rpgdm.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Something that happened in a scene. Events are never edited; a correction is a new event.
 *
 * @param metadata free-form structured values attached by the caller; integral numbers are
 *        held as {@code Long} so a saved and reloaded event compares equal
 * @param extensions payload fields read from storage that the payload type does not know;
 *        written back unchanged
 */
public record Event(
        String id,
        Instant timestamp,
        EventType type,
        String actor,
        EventPayload payload,
        Map<String, Object> metadata,
        Map<String, Object> extensions) {

    public Event {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        if (payload.type() != type) {
            throw new IllegalArgumentException(
                    "Payload %s does not match event type %s".formatted(payload.type(), type));
        }
        metadata = frozen(metadata);
        extensions = frozen(extensions);
    }

    public Event(String id, Instant timestamp, String actor, EventPayload payload, Map<String, Object> metadata) {
        this(id, timestamp, payload.type(), actor, payload, metadata, Map.of());
    }

    public Optional<String> actorName() {
        return Optional.ofNullable(actor);
    }

    /** One line of narrative text: {@code [actor] content} */
    public String render() {
        return actor == null ? payload.describe() : "[" + actor + "] " + payload.describe();
    }

    // Map.copyOf rejects null values, which JSON metadata may legitimately contain
    private static Map<String, Object> frozen(Map<?, ?> map) {
        if (map == null || map.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), normalize(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Values take the shape they have after a JSON round trip: integral numbers are
     * {@code Long}, {@code Float} is {@code Double}, nested maps and lists are copied.
     */
    private static Object normalize(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return Double.valueOf(f.toString());
        }
        if (value instanceof Map<?, ?> map) {
            return frozen(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(normalize(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
