package dk.cloudcreate.essentials.micro.eventstore;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.eventstore.metadata.MetadataMatcher;

import java.util.*;
import java.util.stream.Stream;

/**
 * Narrow contract for an append-only event store.<br>
 * Events are stored in named streams (see {@link StreamName}). The position of the first event in a stream is <b>1</b>.<br>
 * Optimistic concurrency is the responsibility of the implementation: {@link #appendTo(StreamName, List)} and
 * {@link #create(StreamName, List)} must reject a write that conflicts with a concurrent writer by throwing
 * a {@link ConcurrencyException}.
 */
public interface EventStore {
    /**
     * Check if a stream with the given name exists
     *
     * @param streamName the name of the stream
     * @return true if the stream exists, otherwise false
     */
    boolean hasStream(StreamName streamName);

    /**
     * Load the events from a stream
     *
     * @param streamName      the name of the stream
     * @param fromNumber      the stream position of the first event to include (1 based)
     * @param count           the maximum number of events to include (empty means no limit)
     * @param metadataMatcher optional filter that every returned event must match
     * @return a lazy, finite and forward-only stream of the matching events in stream order
     * @throws StreamNotFoundException in case the stream doesn't exist
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    Stream<Message> load(StreamName streamName,
                         long fromNumber,
                         Optional<Long> count,
                         Optional<MetadataMatcher> metadataMatcher);

    /**
     * Load all events from a stream
     *
     * @param streamName the name of the stream
     * @return a lazy, finite and forward-only stream of all events in stream order
     * @throws StreamNotFoundException in case the stream doesn't exist
     */
    default Stream<Message> load(StreamName streamName) {
        return load(streamName, 1, Optional.empty(), Optional.empty());
    }

    /**
     * Append events to an existing stream
     *
     * @param streamName the name of the stream
     * @param events     the events to append (in order)
     * @throws StreamNotFoundException in case the stream doesn't exist
     * @throws ConcurrencyException    in case the write conflicts with a concurrent writer
     */
    void appendTo(StreamName streamName, List<Message> events);

    /**
     * Create a new stream with the given events as its initial content
     *
     * @param streamName    the name of the stream
     * @param initialEvents the initial events (in order)
     * @throws StreamExistsAlreadyException in case the stream already exists
     * @throws ConcurrencyException         in case the write conflicts with a concurrent writer
     */
    void create(StreamName streamName, List<Message> initialEvents);
}
