package dev.ebullient.rpgdm.model;

/**
 * Criteria for {@code SessionLog.queryEvents}. Null fields match everything.
 */
public record EventFilter(EventType type, String actor, String sceneId, TimeRange timeRange) {

    private static final EventFilter ALL = new EventFilter(null, null, null, null);

    public static EventFilter all() {
        return ALL;
    }

    public EventFilter ofType(EventType type) {
        return new EventFilter(type, actor, sceneId, timeRange);
    }

    public EventFilter byActor(String actor) {
        return new EventFilter(type, actor, sceneId, timeRange);
    }

    public EventFilter inScene(String sceneId) {
        return new EventFilter(type, actor, sceneId, timeRange);
    }

    public EventFilter during(TimeRange timeRange) {
        return new EventFilter(type, actor, sceneId, timeRange);
    }

    public boolean matchesScene(Scene scene) {
        return sceneId == null || sceneId.equals(scene.id());
    }

    public boolean matches(Event event) {
        return (type == null || type == event.type())
                && (actor == null || actor.equals(event.actor()))
                && (timeRange == null || timeRange.contains(event.timestamp()));
    }
}
