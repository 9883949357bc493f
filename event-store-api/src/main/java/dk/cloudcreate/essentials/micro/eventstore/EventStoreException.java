package dk.cloudcreate.essentials.micro.eventstore;

/**
 * Base exception for all failures reported by an {@link EventStore} implementation
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
