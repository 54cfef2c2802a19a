package dev.ebullient.rpgdm.model;

import java.util.List;
import java.util.Objects;

/**
 * Typed content of an {@link Event}. There is exactly one payload shape per {@link EventType}.
 */
public sealed interface EventPayload {

    EventType type();

    /** Plain text rendering used when the event is shown to the narrator. */
    String describe();

    record Narration(String text) implements EventPayload {
        public Narration {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public EventType type() {
            return EventType.NARRATION;
        }

        @Override
        public String describe() {
            return text;
        }
    }

    record PlayerAction(String text) implements EventPayload {
        public PlayerAction {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public EventType type() {
            return EventType.PLAYER_ACTION;
        }

        @Override
        public String describe() {
            return text;
        }
    }

    record DiceRoll(String notation, int total, List<Integer> rolls, List<Integer> kept, String details)
            implements EventPayload {
        public DiceRoll {
            Objects.requireNonNull(notation, "notation");
            rolls = List.copyOf(rolls);
            kept = List.copyOf(kept);
            details = details == null ? "" : details;
        }

        public static DiceRoll of(RollResult result) {
            return new DiceRoll(result.spec().toNotation(), result.total(),
                    result.rolls(), result.kept(), result.details());
        }

        @Override
        public EventType type() {
            return EventType.DICE_ROLL;
        }

        @Override
        public String describe() {
            return "rolled %s → %d (%s)".formatted(notation, total, details);
        }
    }

    record NpcAction(String text) implements EventPayload {
        public NpcAction {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public EventType type() {
            return EventType.NPC_ACTION;
        }

        @Override
        public String describe() {
            return text;
        }
    }

    record NpcDialogue(String text) implements EventPayload {
        public NpcDialogue {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public EventType type() {
            return EventType.NPC_DIALOGUE;
        }

        @Override
        public String describe() {
            return "\"" + text + "\"";
        }
    }

    record SystemNotice(String text) implements EventPayload {
        public SystemNotice {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public EventType type() {
            return EventType.SYSTEM;
        }

        @Override
        public String describe() {
            return text;
        }
    }

    record ToolCall(String tool, String arguments, String result) implements EventPayload {
        public ToolCall {
            Objects.requireNonNull(tool, "tool");
            arguments = arguments == null ? "" : arguments;
            result = result == null ? "" : result;
        }

        @Override
        public EventType type() {
            return EventType.TOOL_CALL;
        }

        @Override
        public String describe() {
            return "%s(%s) → %s".formatted(tool, arguments, result);
        }
    }

    /** {@code previous} and {@code current} are null when the key was added or removed. */
    record StateChange(String key, String previous, String current) implements EventPayload {
        public StateChange {
            Objects.requireNonNull(key, "key");
        }

        @Override
        public EventType type() {
            return EventType.STATE_CHANGE;
        }

        @Override
        public String describe() {
            return "%s: %s → %s".formatted(key,
                    previous == null ? "—" : previous,
                    current == null ? "—" : current);
        }
    }
}
