package dev.ebullient.rpgdm.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * One play-through: an ordered list of scenes, at most one of them active.
 * <p>
 * A session is a plain owned value passed to the services that act on it. Writers hold
 * {@link #lock()}'s write lock; readers that need a consistent view hold the read lock.
 */
public class Session {

    private final String id;
    private final Instant createdAt;
    private final List<Scene> scenes;
    private Integer activeSceneIndex;

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private volatile boolean dirty;

    public Session(String id, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.scenes = new ArrayList<>();
    }

    /**
     * Rebuild a session read back from storage.
     *
     * @throws IllegalArgumentException if the active index does not point at the only active scene
     */
    public static Session restore(String id, Instant createdAt, List<Scene> scenes, Integer activeSceneIndex) {
        Session session = new Session(id, createdAt);
        session.scenes.addAll(scenes);
        long activeCount = scenes.stream().filter(Scene::isActive).count();
        if (activeSceneIndex == null) {
            if (activeCount > 0) {
                throw new IllegalArgumentException("Session " + id + " has an active scene but no active index");
            }
        } else if (activeSceneIndex < 0 || activeSceneIndex >= scenes.size()
                || !scenes.get(activeSceneIndex).isActive() || activeCount != 1) {
            throw new IllegalArgumentException("Session " + id + " has an invalid active scene index " + activeSceneIndex);
        }
        session.activeSceneIndex = activeSceneIndex;
        return session;
    }

    /**
     * Add a new scene and make it the active one. Any previously active scene must
     * already have been ended.
     */
    public void addActiveScene(Scene scene) {
        if (activeScene().isPresent()) {
            throw new IllegalStateException("Session " + id + " already has an active scene");
        }
        if (!scene.isActive()) {
            throw new IllegalArgumentException("Scene " + scene.id() + " has already ended");
        }
        scenes.add(scene);
        activeSceneIndex = scenes.size() - 1;
    }

    /**
     * Clear the active scene pointer after the active scene has been ended.
     */
    public void clearActiveScene() {
        if (activeSceneIndex != null && scenes.get(activeSceneIndex).isActive()) {
            throw new IllegalStateException("Active scene has not been ended");
        }
        activeSceneIndex = null;
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public List<Scene> scenes() {
        return Collections.unmodifiableList(scenes);
    }

    public Optional<Scene> scene(String sceneId) {
        return scenes.stream().filter(s -> s.id().equals(sceneId)).findFirst();
    }

    public OptionalInt activeSceneIndex() {
        return activeSceneIndex == null ? OptionalInt.empty() : OptionalInt.of(activeSceneIndex);
    }

    public Optional<Scene> activeScene() {
        return activeSceneIndex == null ? Optional.empty() : Optional.of(scenes.get(activeSceneIndex));
    }

    public int eventCount() {
        return scenes.stream().mapToInt(Scene::eventCount).sum();
    }

    public ReadWriteLock lock() {
        return lock;
    }

    /** True when in-memory changes have not been written to storage yet. */
    public boolean isDirty() {
        return dirty;
    }

    public void markDirty() {
        dirty = true;
    }

    public void markClean() {
        dirty = false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Session other)) {
            return false;
        }
        return id.equals(other.id)
                && createdAt.equals(other.createdAt)
                && scenes.equals(other.scenes)
                && Objects.equals(activeSceneIndex, other.activeSceneIndex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, createdAt, scenes, activeSceneIndex);
    }

    @Override
    public String toString() {
        return "Session[%s, %d scenes, active=%s]".formatted(id, scenes.size(), activeSceneIndex);
    }
}
