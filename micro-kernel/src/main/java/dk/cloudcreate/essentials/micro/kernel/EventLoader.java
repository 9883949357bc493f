package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.eventstore.*;
import dk.cloudcreate.essentials.micro.eventstore.metadata.MetadataMatcher;
import dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition;
import org.slf4j.*;

import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Loads aggregate events from the {@link EventStore} and replays them onto the aggregate state.<br>
 * There are two replay paths:
 * <ul>
 *     <li>{@link #replayFullHistory(Message, AggregateDefinition, EventStoreFactory)} - no prior state is known,
 *     so every event of the aggregate (version 1 and up) is replayed onto an empty state</li>
 *     <li>{@link #replaySinceSnapshot(Map, Message, AggregateDefinition, EventStoreFactory)} - the state came from a snapshot,
 *     so only the events newer than the snapshot version are replayed</li>
 * </ul>
 */
public final class EventLoader {
    private static final Logger log = LoggerFactory.getLogger(EventLoader.class);

    private EventLoader() {
    }

    /**
     * Load events from a stream. A stream that doesn't exist yields no events
     *
     * @param streamName        the stream name
     * @param fromNumber        the stream position of the first event to include (1 based)
     * @param metadataMatcher   optional event filter
     * @param eventStoreFactory the event store factory
     * @return the events in stream order
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static Stream<Message> loadEvents(StreamName streamName,
                                             long fromNumber,
                                             Optional<MetadataMatcher> metadataMatcher,
                                             EventStoreFactory eventStoreFactory) {
        requireNonNull(streamName, "No streamName provided");
        requireNonNull(metadataMatcher, "No metadataMatcher option provided");
        requireNonNull(eventStoreFactory, "No eventStoreFactory provided");

        var eventStore = eventStoreFactory.requireEventStore();
        if (!eventStore.hasStream(streamName)) {
            log.trace("Stream '{}' doesn't exist", streamName);
            return Stream.empty();
        }
        return eventStore.load(streamName, fromNumber, Optional.empty(), metadataMatcher);
    }

    /**
     * Replay the events of the aggregate the command targets onto the state
     *
     * @param state             the state from {@link StateLoader} (empty if no snapshot exists)
     * @param message           the command
     * @param definition        the aggregate definition
     * @param eventStoreFactory the event store factory
     * @return the reconstituted state
     */
    public static Map<String, Object> reconstituteState(Map<String, Object> state,
                                                        Message message,
                                                        AggregateDefinition definition,
                                                        EventStoreFactory eventStoreFactory) {
        requireNonNull(state, "No state provided");
        if (state.isEmpty()) {
            return replayFullHistory(message, definition, eventStoreFactory);
        }
        return replaySinceSnapshot(state, message, definition, eventStoreFactory);
    }

    /**
     * Replay all events of the aggregate onto an empty state
     */
    public static Map<String, Object> replayFullHistory(Message message,
                                                        AggregateDefinition definition,
                                                        EventStoreFactory eventStoreFactory) {
        requireNonNull(message, "No message provided");
        requireNonNull(definition, "No definition provided");

        var aggregateId = definition.extractAggregateId(message);
        var events = loadEvents(definition.streamName(aggregateId),
                                1,
                                definition.metadataMatcher(aggregateId, 1),
                                eventStoreFactory);
        return definition.reconstituteState(Map.of(), events);
    }

    /**
     * Replay the events newer than the snapshot state onto the snapshot state.<br>
     * The events are selected using {@link AggregateDefinition#metadataMatcher(String, long)} from the version following
     * the snapshot version. If the definition provides no matcher and has one stream per aggregate, the snapshot version is
     * used as a stream position instead: the load starts at stream position <code>snapshot version + 1</code>.
     * That only skips the right events when every event increments the aggregate version by exactly 1 starting from version 1,
     * i.e. when the aggregate version of each event equals its position in the stream. Definitions whose
     * <code>apply</code> fold doesn't guarantee that must provide a metadata matcher.
     *
     * @param snapshotState     the state from the snapshot, carrying the aggregate version
     * @param message           the command
     * @param definition        the aggregate definition
     * @param eventStoreFactory the event store factory
     * @return the reconstituted state
     */
    public static Map<String, Object> replaySinceSnapshot(Map<String, Object> snapshotState,
                                                          Message message,
                                                          AggregateDefinition definition,
                                                          EventStoreFactory eventStoreFactory) {
        requireNonNull(snapshotState, "No snapshotState provided");
        requireNonNull(message, "No message provided");
        requireNonNull(definition, "No definition provided");

        var aggregateId     = definition.extractAggregateId(message);
        var nextVersion     = definition.extractAggregateVersion(snapshotState) + 1;
        var metadataMatcher = definition.metadataMatcher(aggregateId, nextVersion);

        long fromNumber = 1;
        if (metadataMatcher.isEmpty() && definition.hasOneStreamPerAggregate()) {
            // No matcher, so skip the events covered by the snapshot using the stream position (version == stream position)
            fromNumber = nextVersion;
        }
        log.trace("Replaying '{}' with id '{}' from version {}", definition.aggregateType(), aggregateId, nextVersion);
        var events = loadEvents(definition.streamName(aggregateId),
                                fromNumber,
                                metadataMatcher,
                                eventStoreFactory);
        return definition.reconstituteState(snapshotState, events);
    }
}
