package dev.ebullient.rpgdm.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SessionStats(
        String sessionId,
        int sceneCount,
        int eventCount,
        String activeScene,
        Instant firstEvent,
        Instant lastEvent,
        Map<EventType, Integer> eventTypes,
        List<SceneOverview> scenes) {

    public record SceneOverview(String id, String title, String location, int eventCount, boolean active) {
    }
}
