package dev.ebullient.rpgdm.model;

import java.util.Locale;

public enum EventType {
    NARRATION,
    PLAYER_ACTION,
    DICE_ROLL,
    NPC_ACTION,
    NPC_DIALOGUE,
    SYSTEM,
    TOOL_CALL,
    STATE_CHANGE;

    /** Name used in persisted documents, e.g. {@code player_action} */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventType fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
