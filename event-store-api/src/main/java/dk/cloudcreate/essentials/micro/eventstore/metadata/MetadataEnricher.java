package dk.cloudcreate.essentials.micro.eventstore.metadata;

import dk.cloudcreate.essentials.micro.common.messaging.Message;

/**
 * Stamps additional metadata onto a {@link Message} before it's persisted.<br>
 * Since a {@link Message} is immutable the enriched message is always a NEW instance
 */
@FunctionalInterface
public interface MetadataEnricher {
    Message enrich(Message message);

    /**
     * Combine this enricher with <code>next</code>, such that this enricher is applied first
     *
     * @param next the enricher to apply after this enricher
     * @return the combined enricher
     */
    default MetadataEnricher andThen(MetadataEnricher next) {
        return message -> next.enrich(enrich(message));
    }
}
