package dk.cloudcreate.essentials.micro.kernel.definition;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.eventstore.StreamName;
import dk.cloudcreate.essentials.micro.eventstore.metadata.*;
import dk.cloudcreate.essentials.micro.kernel.MissingRequiredFieldException;

import java.util.*;
import java.util.stream.Stream;

/**
 * Describes an aggregate type to the kernel: how its identity and version are found, in which stream its
 * events are stored, how its events are selected and stamped with metadata, and how its state is folded from events.<br>
 * An aggregate's state is a plain field map. The aggregate behaviour lives in pure command handler functions
 * (see {@link dk.cloudcreate.essentials.micro.kernel.command.CommandHandler}) and in {@link #apply(Map, Message...)}.<br>
 * Most definitions extend {@link AbstractAggregateDefinition}, which provides the default behaviour for everything
 * except {@link #aggregateType()} and {@link #apply(Map, Message...)}
 */
public interface AggregateDefinition {
    /**
     * @return the name of the payload/state field that holds the aggregate id
     */
    String identifierName();

    /**
     * @return the name of the state field that holds the aggregate version
     */
    String versionName();

    /**
     * @return the aggregate type, e.g. <code>user</code>
     */
    String aggregateType();

    /**
     * Extract the aggregate id from the payload of a message
     *
     * @param message the message
     * @return the aggregate id (in its string form)
     * @throws MissingRequiredFieldException in case the payload doesn't contain {@link #identifierName()}
     */
    String extractAggregateId(Message message);

    /**
     * Extract the aggregate version from an aggregate state
     *
     * @param state the aggregate state
     * @return the aggregate version
     * @throws MissingRequiredFieldException in case the state doesn't contain a numeric {@link #versionName()}
     */
    long extractAggregateVersion(Map<String, Object> state);

    /**
     * Extract the aggregate version from the payload of a message
     *
     * @param message the message
     * @return the aggregate version
     * @throws MissingRequiredFieldException in case the payload doesn't contain a numeric {@link #versionName()}
     */
    long extractAggregateVersion(Message message);

    /**
     * @return true if each aggregate instance has its own stream, false if all instances share one stream per aggregate type
     */
    boolean hasOneStreamPerAggregate();

    /**
     * Resolve the stream that contains the events of the given aggregate
     *
     * @param aggregateId the aggregate id
     * @return the stream name
     */
    StreamName streamName(String aggregateId);

    /**
     * Create the matcher that selects the events of one aggregate instance from its stream
     *
     * @param aggregateId the aggregate id
     * @param fromVersion the lowest aggregate version to include
     * @return the matcher or {@link Optional#empty()} if the events shouldn't be filtered
     */
    Optional<MetadataMatcher> metadataMatcher(String aggregateId, long fromVersion);

    /**
     * Create the enricher that stamps the aggregate metadata on raised events before they're persisted
     *
     * @param aggregateId      the aggregate id
     * @param aggregateVersion the aggregate version after the command was handled
     * @return the enricher or {@link Optional#empty()} if the events should be persisted as they are
     */
    default Optional<MetadataEnricher> metadataEnricher(String aggregateId, long aggregateVersion) {
        return metadataEnricher(aggregateId, aggregateVersion, Optional.empty());
    }

    /**
     * Create the enricher that stamps the aggregate metadata on raised events before they're persisted
     *
     * @param aggregateId      the aggregate id
     * @param aggregateVersion the aggregate version after the command was handled
     * @param causationMessage the message (if known) that caused the events to be raised
     * @return the enricher or {@link Optional#empty()} if the events should be persisted as they are
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    Optional<MetadataEnricher> metadataEnricher(String aggregateId, long aggregateVersion, Optional<Message> causationMessage);

    /**
     * Left fold the events onto the state using {@link #apply(Map, Message...)}
     *
     * @param state  the initial state
     * @param events the events (the stream is consumed and closed)
     * @return the resulting state
     */
    Map<String, Object> reconstituteState(Map<String, Object> state, Stream<Message> events);

    /**
     * Apply the events, in order, to the state
     *
     * @param state  the current state
     * @param events the events to apply
     * @return the new state
     */
    Map<String, Object> apply(Map<String, Object> state, Message... events);
}
