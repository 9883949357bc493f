package dk.cloudcreate.essentials.micro.eventstore;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamExistsAlreadyException extends EventStoreException {
    public final StreamName streamName;

    public StreamExistsAlreadyException(StreamName streamName) {
        super(msg("Stream '{}' already exists", streamName));
        this.streamName = requireNonNull(streamName, "No streamName provided");
    }
}
