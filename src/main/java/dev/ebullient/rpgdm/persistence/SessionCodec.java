package dev.ebullient.rpgdm.persistence;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.ebullient.rpgdm.StorageFailureException;
import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.EventPayload;
import dev.ebullient.rpgdm.model.EventType;
import dev.ebullient.rpgdm.model.Scene;
import dev.ebullient.rpgdm.model.Session;

/**
 * Converts a {@link Session} to and from its JSON document.
 * <p>
 * The document nests scenes and events as they are held in memory. Event payload
 * fields depend on the event type; payload fields this version does not know are
 * carried in {@link Event#extensions()} and written back as they were read.
 */
@Singleton
public class SessionCodec {

    public static final int FORMAT_VERSION = 1;

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    @Inject
    public SessionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] encode(Session session) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(toJson(session));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to encode session " + session.id(), e);
        }
    }

    public Session decode(byte[] document) {
        JsonNode root;
        try {
            root = mapper.readTree(document);
        } catch (IOException e) {
            throw new StorageFailureException("Session document is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new StorageFailureException("Session document must be a JSON object");
        }
        try {
            return fromJson(root);
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new StorageFailureException("Corrupt session document: " + e.getMessage(), e);
        }
    }

    ObjectNode toJson(Session session) {
        ObjectNode root = mapper.createObjectNode();
        root.put("formatVersion", FORMAT_VERSION);
        root.put("id", session.id());
        root.put("createdAt", session.createdAt().toString());
        if (session.activeSceneIndex().isPresent()) {
            root.put("activeSceneIndex", session.activeSceneIndex().getAsInt());
        } else {
            root.putNull("activeSceneIndex");
        }
        ArrayNode scenes = root.putArray("scenes");
        for (Scene scene : session.scenes()) {
            scenes.add(toJson(scene));
        }
        return root;
    }

    private ObjectNode toJson(Scene scene) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", scene.id());
        node.put("title", scene.title());
        node.put("location", scene.location());
        ArrayNode participants = node.putArray("participants");
        scene.participants().forEach(participants::add);
        node.put("startedAt", scene.startedAt().toString());
        node.put("endedAt", scene.endedAt().map(Instant::toString).orElse(null));
        node.put("summary", scene.summary().orElse(null));
        node.put("active", scene.isActive());
        ArrayNode events = node.putArray("events");
        for (Event event : scene.events()) {
            events.add(toJson(event));
        }
        return node;
    }

    private ObjectNode toJson(Event event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("id", event.id());
        node.put("timestamp", event.timestamp().toString());
        node.put("type", event.type().key());
        node.put("actor", event.actor());

        ObjectNode payload = payloadJson(event.payload());
        for (Map.Entry<String, Object> extra : event.extensions().entrySet()) {
            if (!payload.has(extra.getKey())) {
                payload.set(extra.getKey(), mapper.valueToTree(extra.getValue()));
            }
        }
        node.set("payload", payload);
        node.set("metadata", mapper.valueToTree(event.metadata()));
        return node;
    }

    private ObjectNode payloadJson(EventPayload payload) {
        ObjectNode node = mapper.createObjectNode();
        switch (payload.type()) {
            case NARRATION -> node.put("text", ((EventPayload.Narration) payload).text());
            case PLAYER_ACTION -> node.put("text", ((EventPayload.PlayerAction) payload).text());
            case NPC_ACTION -> node.put("text", ((EventPayload.NpcAction) payload).text());
            case NPC_DIALOGUE -> node.put("text", ((EventPayload.NpcDialogue) payload).text());
            case SYSTEM -> node.put("text", ((EventPayload.SystemNotice) payload).text());
            case DICE_ROLL -> {
                EventPayload.DiceRoll roll = (EventPayload.DiceRoll) payload;
                node.put("notation", roll.notation());
                node.put("total", roll.total());
                ArrayNode rolls = node.putArray("rolls");
                for (int value : roll.rolls()) {
                    rolls.add(value);
                }
                ArrayNode kept = node.putArray("kept");
                for (int value : roll.kept()) {
                    kept.add(value);
                }
                node.put("details", roll.details());
            }
            case TOOL_CALL -> {
                EventPayload.ToolCall call = (EventPayload.ToolCall) payload;
                node.put("tool", call.tool());
                node.put("arguments", call.arguments());
                node.put("result", call.result());
            }
            case STATE_CHANGE -> {
                EventPayload.StateChange change = (EventPayload.StateChange) payload;
                node.put("key", change.key());
                node.put("previous", change.previous());
                node.put("current", change.current());
            }
        }
        return node;
    }

    Session fromJson(JsonNode root) {
        int version = root.path("formatVersion").asInt(FORMAT_VERSION);
        if (version > FORMAT_VERSION) {
            throw new IllegalArgumentException("unsupported format version " + version);
        }
        List<Scene> scenes = new ArrayList<>();
        for (JsonNode scene : root.path("scenes")) {
            scenes.add(sceneFromJson(scene));
        }
        JsonNode active = root.get("activeSceneIndex");
        return Session.restore(
                requiredText(root, "id"),
                Instant.parse(requiredText(root, "createdAt")),
                scenes,
                active == null || active.isNull() ? null : active.asInt());
    }

    private Scene sceneFromJson(JsonNode node) {
        Set<String> participants = new LinkedHashSet<>();
        node.path("participants").forEach(p -> participants.add(p.asText()));
        List<Event> events = new ArrayList<>();
        for (JsonNode event : node.path("events")) {
            events.add(eventFromJson(event));
        }
        String endedAt = text(node, "endedAt");
        return Scene.restore(
                requiredText(node, "id"),
                text(node, "title"),
                text(node, "location"),
                participants,
                Instant.parse(requiredText(node, "startedAt")),
                endedAt == null ? null : Instant.parse(endedAt),
                text(node, "summary"),
                events,
                node.path("active").asBoolean(endedAt == null));
    }

    private Event eventFromJson(JsonNode node) {
        EventType type = EventType.fromKey(requiredText(node, "type"));
        JsonNode payloadNode = node.path("payload");
        Set<String> known = new LinkedHashSet<>();
        EventPayload payload = payloadFromJson(type, payloadNode, known);

        Map<String, Object> extensions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = payloadNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!known.contains(field.getKey())) {
                extensions.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
            }
        }

        JsonNode metadataNode = node.get("metadata");
        Map<String, Object> metadata = metadataNode == null || metadataNode.isNull()
                ? Map.of()
                : mapper.convertValue(metadataNode, MAP_TYPE);

        return new Event(
                requiredText(node, "id"),
                Instant.parse(requiredText(node, "timestamp")),
                type,
                text(node, "actor"),
                payload,
                metadata,
                extensions);
    }

    private EventPayload payloadFromJson(EventType type, JsonNode node, Set<String> known) {
        return switch (type) {
            case NARRATION -> new EventPayload.Narration(field(node, "text", known));
            case PLAYER_ACTION -> new EventPayload.PlayerAction(field(node, "text", known));
            case NPC_ACTION -> new EventPayload.NpcAction(field(node, "text", known));
            case NPC_DIALOGUE -> new EventPayload.NpcDialogue(field(node, "text", known));
            case SYSTEM -> new EventPayload.SystemNotice(field(node, "text", known));
            case DICE_ROLL -> new EventPayload.DiceRoll(
                    field(node, "notation", known),
                    intField(node, "total", known),
                    intList(node, "rolls", known),
                    intList(node, "kept", known),
                    field(node, "details", known));
            case TOOL_CALL -> new EventPayload.ToolCall(
                    field(node, "tool", known),
                    field(node, "arguments", known),
                    field(node, "result", known));
            case STATE_CHANGE -> new EventPayload.StateChange(
                    field(node, "key", known),
                    field(node, "previous", known),
                    field(node, "current", known));
        };
    }

    private static String field(JsonNode node, String name, Set<String> known) {
        known.add(name);
        return text(node, name);
    }

    private static int intField(JsonNode node, String name, Set<String> known) {
        known.add(name);
        JsonNode value = node.get(name);
        if (value == null || !value.canConvertToInt()) {
            throw new IllegalArgumentException("missing or invalid integer field '" + name + "'");
        }
        return value.asInt();
    }

    private static List<Integer> intList(JsonNode node, String name, Set<String> known) {
        known.add(name);
        List<Integer> values = new ArrayList<>();
        node.path(name).forEach(v -> values.add(v.asInt()));
        return values;
    }

    private static String text(JsonNode node, String name) {
        JsonNode value = node.get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static String requiredText(JsonNode node, String name) {
        String value = text(node, name);
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + name + "'");
        }
        return value;
    }
}
