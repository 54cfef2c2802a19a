package dev.ebullient.rpgdm.persistence;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.rpgdm.StorageFailureException;
import dev.ebullient.rpgdm.model.Session;

/**
 * Stores each session as {@code <session-dir>/<id>.json}.
 */
@Singleton
public class FileSessionStore implements SessionStore {
    private static final Logger log = Logger.getLogger(FileSessionStore.class);

    private static final String SUFFIX = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    @ConfigProperty(name = "rpgdm.session.dir", defaultValue = "${user.home}/.rpgdm/sessions")
    String sessionDir;

    @Inject
    SessionCodec codec;

    private Path resolveSessionDir() {
        Path dir = Path.of(sessionDir);
        if (!Files.isDirectory(dir)) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StorageFailureException("Cannot create session directory: " + dir, e);
            }
        }
        return dir;
    }

    Path sessionPath(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
        return resolveSessionDir().resolve(sessionId + SUFFIX);
    }

    @Override
    public void save(Session session) {
        Path path = sessionPath(session.id());
        byte[] document = codec.encode(session);
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            Files.write(tmp, document);
            try {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debugf("Saved session %s (%d bytes)", session.id(), document.length);
        } catch (IOException e) {
            throw new StorageFailureException("Failed to save session " + session.id() + " to " + path, e);
        }
    }

    @Override
    public Optional<Session> load(String sessionId) {
        Path path = sessionPath(sessionId);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(codec.decode(Files.readAllBytes(path)));
        } catch (IOException e) {
            throw new StorageFailureException("Failed to read session " + sessionId + " from " + path, e);
        }
    }

    @Override
    public List<String> list() {
        Path dir = resolveSessionDir();
        try (Stream<Path> files = Files.list(dir)) {
            return files
                    .map(p -> p.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new StorageFailureException("Failed to list sessions in " + dir, e);
        }
    }
}
