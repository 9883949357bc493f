package dk.cloudcreate.essentials.micro.eventstore;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

public class StreamNotFoundException extends EventStoreException {
    public final StreamName streamName;

    public StreamNotFoundException(StreamName streamName) {
        super(msg("Stream '{}' could not be found", streamName));
        this.streamName = requireNonNull(streamName, "No streamName provided");
    }
}
