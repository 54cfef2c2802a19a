package dev.ebullient.rpgdm.persistence;

import java.util.List;
import java.util.Optional;

import dev.ebullient.rpgdm.model.Session;

/**
 * Durable storage for whole session documents.
 * Implementations report I/O problems as {@link dev.ebullient.rpgdm.StorageFailureException}.
 */
public interface SessionStore {

    void save(Session session);

    Optional<Session> load(String sessionId);

    /** Ids of all stored sessions, sorted. */
    List<String> list();
}
