package dk.cloudcreate.essentials.micro.snapshotstore;

/**
 * Base exception for all failures reported by a {@link SnapshotStore} implementation
 */
public class SnapshotStoreException extends RuntimeException {
    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
