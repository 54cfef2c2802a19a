package dev.ebullient.rpgdm;

/**
 * Reading or writing a session document failed. The in-memory session is unaffected.
 */
public class StorageFailureException extends RuntimeException {

    public StorageFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    public StorageFailureException(String message) {
        super(message);
    }
}
