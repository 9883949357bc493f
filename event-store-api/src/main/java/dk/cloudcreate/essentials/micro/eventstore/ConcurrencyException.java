package dk.cloudcreate.essentials.micro.eventstore;

import java.util.List;

/**
 * Thrown by {@link EventStore#appendTo(StreamName, List)} or {@link EventStore#create(StreamName, List)}
 * when the write conflicts with a concurrent writer, e.g. because the expected aggregate version
 * has already been superseded
 */
public class ConcurrencyException extends EventStoreException {
    public ConcurrencyException(String msg) {
        super(msg);
    }

    public ConcurrencyException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
