package dk.cloudcreate.essentials.micro.kernel.definition;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.eventstore.StreamName;
import dk.cloudcreate.essentials.micro.eventstore.metadata.*;
import dk.cloudcreate.essentials.micro.kernel.MissingRequiredFieldException;

import java.math.BigDecimal;
import java.util.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Default {@link AggregateDefinition} behaviour:
 * <ul>
 *     <li>the aggregate id is found in the <code>id</code> field and the version in the <code>version</code> field</li>
 *     <li>all instances of the aggregate type share one stream named after {@link #aggregateType()}
 *     (override {@link #hasOneStreamPerAggregate()} to get a <code>{aggregateType}-{aggregateId}</code> stream per instance)</li>
 *     <li>events are selected using the {@link #AGGREGATE_ID}, {@link #AGGREGATE_TYPE} and {@link #AGGREGATE_VERSION} metadata</li>
 *     <li>raised events are stamped with the same three metadata keys</li>
 * </ul>
 * Subclasses must implement {@link #aggregateType()} and {@link #apply(Map, Message...)}
 */
public abstract class AbstractAggregateDefinition implements AggregateDefinition {
    public static final String AGGREGATE_ID      = "_aggregate_id";
    public static final String AGGREGATE_TYPE    = "_aggregate_type";
    public static final String AGGREGATE_VERSION = "_aggregate_version";

    @Override
    public String identifierName() {
        return "id";
    }

    @Override
    public String versionName() {
        return "version";
    }

    @Override
    public String extractAggregateId(Message message) {
        requireNonNull(message, "No message provided");
        var aggregateId = message.payload().get(identifierName());
        if (aggregateId == null) {
            throw new MissingRequiredFieldException(identifierName(), msg("the payload of message '{}'", message.messageName()));
        }
        return aggregateId.toString();
    }

    @Override
    public long extractAggregateVersion(Map<String, Object> state) {
        requireNonNull(state, "No state provided");
        return toVersion(state.get(versionName()), msg("the state of aggregate type '{}'", aggregateType()));
    }

    @Override
    public long extractAggregateVersion(Message message) {
        requireNonNull(message, "No message provided");
        return toVersion(message.payload().get(versionName()), msg("the payload of message '{}'", message.messageName()));
    }

    /**
     * Integral numbers within the <code>long</code> range (e.g. <code>2</code>, <code>2L</code>, <code>2.0</code>)
     * and numeric strings are accepted. Fractional, non finite or out of range numbers are rejected
     */
    private long toVersion(Object version, String source) {
        if (version instanceof Long || version instanceof Integer || version instanceof Short || version instanceof Byte) {
            return ((Number) version).longValue();
        }
        if (version instanceof Number) {
            try {
                return new BigDecimal(version.toString()).longValueExact();
            } catch (NumberFormatException | ArithmeticException e) {
                throw new MissingRequiredFieldException(versionName(), source, e);
            }
        }
        if (version instanceof CharSequence) {
            try {
                return Long.parseLong(version.toString().trim());
            } catch (NumberFormatException e) {
                throw new MissingRequiredFieldException(versionName(), source, e);
            }
        }
        throw new MissingRequiredFieldException(versionName(), source);
    }

    @Override
    public boolean hasOneStreamPerAggregate() {
        return false;
    }

    @Override
    public StreamName streamName(String aggregateId) {
        if (hasOneStreamPerAggregate()) {
            requireNonNull(aggregateId, "No aggregateId provided");
            return StreamName.of(aggregateType() + "-" + aggregateId);
        }
        return StreamName.of(aggregateType());
    }

    @Override
    public Optional<MetadataMatcher> metadataMatcher(String aggregateId, long fromVersion) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return Optional.of(MetadataMatcher.empty()
                                          .withMetadataMatch(AGGREGATE_ID, Operator.EQUALS, aggregateId)
                                          .withMetadataMatch(AGGREGATE_TYPE, Operator.EQUALS, aggregateType())
                                          .withMetadataMatch(AGGREGATE_VERSION, Operator.GREATER_THAN_EQUALS, fromVersion));
    }

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    @Override
    public Optional<MetadataEnricher> metadataEnricher(String aggregateId, long aggregateVersion, Optional<Message> causationMessage) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(causationMessage, "No causationMessage option provided");
        MetadataEnricher enricher = message -> message.withAddedMetadata(AGGREGATE_ID, aggregateId);
        return Optional.of(enricher.andThen(message -> enrichWithAggregateTypeAndVersion(message, aggregateVersion)));
    }

    /**
     * Stamp the {@link #AGGREGATE_TYPE} and {@link #AGGREGATE_VERSION} metadata on an event.
     * Called by the default {@link #metadataEnricher(String, long, Optional)} after the {@link #AGGREGATE_ID} has been stamped
     *
     * @param event            the event
     * @param aggregateVersion the aggregate version
     * @return the enriched event
     */
    protected Message enrichWithAggregateTypeAndVersion(Message event, long aggregateVersion) {
        return event.withAddedMetadata(AGGREGATE_TYPE, aggregateType())
                    .withAddedMetadata(AGGREGATE_VERSION, aggregateVersion);
    }

    @Override
    public Map<String, Object> reconstituteState(Map<String, Object> state, Stream<Message> events) {
        requireNonNull(state, "No state provided");
        requireNonNull(events, "No events provided");
        var reconstitutedState = state;
        try (events) {
            var iterator = events.iterator();
            while (iterator.hasNext()) {
                reconstitutedState = apply(reconstitutedState, iterator.next());
            }
        }
        return reconstitutedState;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "aggregateType='" + aggregateType() + '\'' +
                ", oneStreamPerAggregate=" + hasOneStreamPerAggregate() +
                '}';
    }
}
