package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.definition.*;
import org.slf4j.*;

import java.util.ArrayList;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Stamps the aggregate metadata on the raised events and persists them to the aggregate's stream
 */
public final class EventPersister {
    private static final Logger log = LoggerFactory.getLogger(EventPersister.class);

    private EventPersister() {
    }

    /**
     * Enrich and persist the raised events. If the aggregate's stream exists the events are appended,
     * otherwise the stream is created with the events as initial content
     *
     * @param result            the result returned by the command handler
     * @param eventStoreFactory the event store factory
     * @param definition        the aggregate definition
     * @param aggregateId       the aggregate id
     * @return a new {@link AggregateResult} with the same state and the enriched events
     */
    public static AggregateResult persistEvents(AggregateResult result,
                                                EventStoreFactory eventStoreFactory,
                                                AggregateDefinition definition,
                                                String aggregateId) {
        requireNonNull(result, "No result provided");
        requireNonNull(eventStoreFactory, "No eventStoreFactory provided");
        requireNonNull(definition, "No definition provided");
        requireNonNull(aggregateId, "No aggregateId provided");

        var aggregateVersion = definition.extractAggregateVersion(result.state());
        var enricher         = definition.metadataEnricher(aggregateId, aggregateVersion);
        var enrichedEvents   = new ArrayList<Message>(result.raisedEvents().size());
        for (var event : result.raisedEvents()) {
            enrichedEvents.add(enricher.isPresent() ? enricher.get().enrich(event) : event);
        }

        var streamName = definition.streamName(aggregateId);
        var eventStore = eventStoreFactory.requireEventStore();
        if (eventStore.hasStream(streamName)) {
            log.debug("Appending {} event(s) to stream '{}'", enrichedEvents.size(), streamName);
            eventStore.appendTo(streamName, enrichedEvents);
        } else {
            log.debug("Creating stream '{}' with {} event(s)", streamName, enrichedEvents.size());
            eventStore.create(streamName, enrichedEvents);
        }
        return result.withRaisedEvents(enrichedEvents);
    }
}
