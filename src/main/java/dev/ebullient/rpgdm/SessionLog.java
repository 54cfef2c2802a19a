package dev.ebullient.rpgdm;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.Lock;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.EventFilter;
import dev.ebullient.rpgdm.model.EventPayload;
import dev.ebullient.rpgdm.model.EventType;
import dev.ebullient.rpgdm.model.RollResult;
import dev.ebullient.rpgdm.model.Scene;
import dev.ebullient.rpgdm.model.Session;
import dev.ebullient.rpgdm.model.SessionStats;
import dev.ebullient.rpgdm.persistence.SessionStore;

/**
 * Append-only record of a play-through. Every mutation is saved through the
 * {@link SessionStore}; when a save fails the session stays as it is in memory,
 * is marked dirty, and the next mutation (or {@link #flush}) writes it again.
 */
@Singleton
public class SessionLog {
    private static final Logger log = Logger.getLogger(SessionLog.class);

    private static final DateTimeFormatter SESSION_ID = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss")
            .withZone(ZoneOffset.UTC);

    @Inject
    SessionStore store;

    Clock clock = Clock.systemUTC();

    /**
     * Create and save a new session.
     *
     * @param name session name; a timestamp is used when blank
     * @throws IllegalStateException if a session with the same id already exists
     */
    public Session createSession(String name) {
        Instant now = clock.instant();
        String id = name == null || name.isBlank() ? SESSION_ID.format(now) : StringUtils.slugify(name);
        if (store.load(id).isPresent()) {
            throw new IllegalStateException("Session already exists: " + id);
        }
        Session session = new Session(id, now);
        Lock lock = session.lock().writeLock();
        lock.lock();
        try {
            autoSave(session);
        } finally {
            lock.unlock();
        }
        log.infof("Created session %s", id);
        return session;
    }

    /**
     * Load a saved session, or create it if it does not exist yet.
     */
    public Session openSession(String name) {
        String id = StringUtils.slugify(name);
        return store.load(id)
                .map(session -> {
                    log.debugf("Loaded session %s (%d scenes)", id, session.scenes().size());
                    return session;
                })
                .orElseGet(() -> createSession(id));
    }

    public Optional<Session> findSession(String id) {
        return store.load(id);
    }

    public List<String> listSessions() {
        return store.list();
    }

    /**
     * Start a new scene. A scene that is still active is ended first, without a summary.
     *
     * @return the id of the new scene
     */
    public String startScene(Session session, String title, String location, Collection<String> participants) {
        Lock lock = session.lock().writeLock();
        lock.lock();
        try {
            Instant now = clock.instant();
            session.activeScene().ifPresent(previous -> {
                previous.end(now, null);
                session.clearActiveScene();
                log.debugf("%s: ended %s to start a new scene", session.id(), previous.id());
            });
            String sceneId = "scene-" + (session.scenes().size() + 1);
            session.addActiveScene(new Scene(sceneId, title, location, participants, now));
            log.debugf("%s: started %s (%s)", session.id(), sceneId, title);
            autoSave(session);
            return sceneId;
        } finally {
            lock.unlock();
        }
    }

    /**
     * End the active scene.
     *
     * @param summary optional summary, used by context assembly for older scenes
     * @throws NoActiveSceneException if no scene is active; the session is unchanged
     */
    public void endScene(Session session, String summary) {
        Lock lock = session.lock().writeLock();
        lock.lock();
        try {
            Scene scene = session.activeScene()
                    .orElseThrow(() -> new NoActiveSceneException(session.id(), "end scene"));
            scene.end(clock.instant(), summary);
            session.clearActiveScene();
            log.debugf("%s: ended %s after %d events", session.id(), scene.id(), scene.eventCount());
            autoSave(session);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Append an event to the active scene.
     *
     * @return the id of the new event
     * @throws NoActiveSceneException if no scene is active
     * @throws IllegalArgumentException if the payload does not belong to the event type
     */
    public String logEvent(Session session, EventType type, String actor, EventPayload payload,
            Map<String, Object> metadata) {
        if (payload.type() != type) {
            throw new IllegalArgumentException(
                    "Payload %s does not match event type %s".formatted(payload.type(), type));
        }
        Lock lock = session.lock().writeLock();
        lock.lock();
        try {
            Scene scene = session.activeScene()
                    .orElseThrow(() -> new NoActiveSceneException(session.id(), "log " + type.key()));
            String eventId = scene.id() + "-" + (scene.eventCount() + 1);
            scene.append(new Event(eventId, clock.instant(), type, actor, payload, metadata, Map.of()));
            autoSave(session);
            return eventId;
        } finally {
            lock.unlock();
        }
    }

    public String logEvent(Session session, String actor, EventPayload payload) {
        return logEvent(session, payload.type(), actor, payload, Map.of());
    }

    /**
     * Record a dice roll. The seed, when the roll was reproducible, goes into the metadata.
     */
    public String logRoll(Session session, String actor, RollResult result) {
        Map<String, Object> metadata = result.seed().isPresent()
                ? Map.<String, Object> of("seed", result.seed().getAsLong())
                : Map.of();
        return logEvent(session, EventType.DICE_ROLL, actor, EventPayload.DiceRoll.of(result), metadata);
    }

    /**
     * Matching events in append order. The result reads a snapshot taken now; events
     * appended later are not visible to it.
     */
    public EventQuery queryEvents(Session session, EventFilter filter) {
        EventFilter criteria = filter == null ? EventFilter.all() : filter;
        Lock lock = session.lock().readLock();
        lock.lock();
        try {
            List<List<Event>> snapshot = new ArrayList<>();
            for (Scene scene : session.scenes()) {
                if (criteria.matchesScene(scene)) {
                    snapshot.add(List.copyOf(scene.events()));
                }
            }
            return new EventQuery(snapshot, criteria);
        } finally {
            lock.unlock();
        }
    }

    /**
     * The most recent events across all scenes, newest first.
     *
     * @throws IllegalArgumentException if {@code limit} is negative
     */
    public List<Event> recentEvents(Session session, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }
        List<Event> all = queryEvents(session, EventFilter.all()).toList();
        List<Event> recent = new ArrayList<>(Math.min(limit, all.size()));
        for (int i = all.size() - 1; i >= 0 && recent.size() < limit; i--) {
            recent.add(all.get(i));
        }
        return recent;
    }

    public SessionStats stats(Session session) {
        Lock lock = session.lock().readLock();
        lock.lock();
        try {
            Map<EventType, Integer> counts = new EnumMap<>(EventType.class);
            List<SessionStats.SceneOverview> overviews = new ArrayList<>();
            Instant first = null;
            Instant last = null;
            for (Scene scene : session.scenes()) {
                overviews.add(new SessionStats.SceneOverview(scene.id(), scene.title(), scene.location(),
                        scene.eventCount(), scene.isActive()));
                for (Event event : scene.events()) {
                    counts.merge(event.type(), 1, Integer::sum);
                    if (first == null) {
                        first = event.timestamp();
                    }
                    last = event.timestamp();
                }
            }
            return new SessionStats(session.id(), session.scenes().size(), session.eventCount(),
                    session.activeScene().map(Scene::displayTitle).orElse(null),
                    first, last, counts, overviews);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Save a session that has unsaved changes.
     *
     * @return true if a save was needed
     * @throws StorageFailureException if the save fails again
     */
    public boolean flush(Session session) {
        Lock lock = session.lock().writeLock();
        lock.lock();
        try {
            if (!session.isDirty()) {
                return false;
            }
            autoSave(session);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void autoSave(Session session) {
        try {
            store.save(session);
            if (session.isDirty()) {
                log.infof("%s: saved after earlier storage failure", session.id());
            }
            session.markClean();
        } catch (StorageFailureException e) {
            session.markDirty();
            log.errorf(e, "%s: failed to save session; keeping changes in memory", session.id());
            throw e;
        }
    }
}
