package dev.ebullient.rpgdm;

/**
 * An operation needed an active scene and the session has none. Start a scene and retry.
 */
public class NoActiveSceneException extends IllegalStateException {

    private final String sessionId;

    public NoActiveSceneException(String sessionId, String operation) {
        super("Cannot %s: session %s has no active scene".formatted(operation, sessionId));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
