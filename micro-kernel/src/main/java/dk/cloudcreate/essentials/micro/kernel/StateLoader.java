package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition;
import dk.cloudcreate.essentials.micro.snapshotstore.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Loads the initial aggregate state for a command from the {@link SnapshotStore}.<br>
 * Without a snapshot store, or without a snapshot for the aggregate, the initial state is empty
 */
public final class StateLoader {
    private static final Logger log = LoggerFactory.getLogger(StateLoader.class);

    private StateLoader() {
    }

    /**
     * @param snapshotStoreFactory the optional snapshot store factory
     * @param message              the command
     * @param definition           the aggregate definition
     * @return the aggregate state from the latest snapshot, or an empty state
     */
    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    public static Map<String, Object> loadState(Optional<SnapshotStoreFactory> snapshotStoreFactory,
                                                Message message,
                                                AggregateDefinition definition) {
        requireNonNull(snapshotStoreFactory, "No snapshotStoreFactory option provided");
        if (snapshotStoreFactory.isEmpty()) {
            return Map.of();
        }
        return loadState(snapshotStoreFactory.get().requireSnapshotStore(), message, definition);
    }

    /**
     * @param snapshotStore the snapshot store
     * @param message       the command
     * @param definition    the aggregate definition
     * @return the aggregate state from the latest snapshot, or an empty state
     */
    public static Map<String, Object> loadState(SnapshotStore snapshotStore,
                                                Message message,
                                                AggregateDefinition definition) {
        requireNonNull(snapshotStore, "No snapshotStore provided");
        requireNonNull(message, "No message provided");
        requireNonNull(definition, "No definition provided");

        var aggregateId = definition.extractAggregateId(message);
        var snapshot    = snapshotStore.get(definition.aggregateType(), aggregateId);
        if (snapshot.isEmpty()) {
            log.trace("No snapshot found for '{}' with id '{}'", definition.aggregateType(), aggregateId);
            return Map.of();
        }
        log.trace("Loaded snapshot of '{}' with id '{}' at version {}",
                  definition.aggregateType(),
                  aggregateId,
                  snapshot.get().lastVersion);
        return snapshot.get().aggregateRoot;
    }
}
