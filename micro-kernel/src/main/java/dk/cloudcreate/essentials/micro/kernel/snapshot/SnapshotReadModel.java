package dk.cloudcreate.essentials.micro.kernel.snapshot;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition;
import dk.cloudcreate.essentials.micro.snapshotstore.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link ReadModel} that maintains aggregate {@link Snapshot}'s by folding events onto the aggregate state
 * using {@link AggregateDefinition#apply(Map, Message...)}.<br>
 * The state of each aggregate touched by {@link #stack(String, Message...)} is kept in memory (seeded from the
 * stored snapshot, if any) until {@link #persist()} saves one snapshot per aggregate.<br>
 * Not thread safe - a projection is expected to drive an instance from a single thread
 */
public final class SnapshotReadModel implements ReadModel {
    private static final Logger log = LoggerFactory.getLogger(SnapshotReadModel.class);

    private final SnapshotStore                    snapshotStore;
    private final AggregateDefinition              definition;
    private final Clock                            clock;
    private final Map<String, Map<String, Object>> stateCache = new LinkedHashMap<>();

    public SnapshotReadModel(SnapshotStore snapshotStore, AggregateDefinition definition) {
        this(snapshotStore, definition, Clock.systemUTC());
    }

    public SnapshotReadModel(SnapshotStore snapshotStore, AggregateDefinition definition, Clock clock) {
        this.snapshotStore = requireNonNull(snapshotStore, "No snapshotStore provided");
        this.definition = requireNonNull(definition, "No definition provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public void stack(String operation, Message... events) {
        requireNonNull(events, "No events provided");
        for (var event : events) {
            requireNonNull(event, "Events must not contain null");
            if (!event.isEvent()) {
                throw new IllegalArgumentException(msg("'{}' is a {} and not an EVENT", event.messageName(), event.messageType()));
            }
            var aggregateId = definition.extractAggregateId(event);
            var state = stateCache.containsKey(aggregateId) ? stateCache.get(aggregateId) : loadSnapshotState(aggregateId);
            stateCache.put(aggregateId, definition.apply(state, event));
        }
    }

    private Map<String, Object> loadSnapshotState(String aggregateId) {
        return snapshotStore.get(definition.aggregateType(), aggregateId)
                            .map(Snapshot::aggregateRoot)
                            .orElse(Map.of());
    }

    @Override
    public void persist() {
        if (stateCache.isEmpty()) {
            return;
        }
        var now       = OffsetDateTime.now(clock);
        var snapshots = new ArrayList<Snapshot>(stateCache.size());
        stateCache.forEach((aggregateId, state) -> snapshots.add(new Snapshot(definition.aggregateType(),
                                                                              aggregateId,
                                                                              state,
                                                                              definition.extractAggregateVersion(state),
                                                                              now)));
        snapshotStore.save(snapshots.toArray(new Snapshot[0]));
        log.debug("Saved {} '{}' snapshot(s)", snapshots.size(), definition.aggregateType());
        stateCache.clear();
    }

    /**
     * @return the number of aggregates stacked since the last {@link #persist()}
     */
    public int pendingSnapshots() {
        return stateCache.size();
    }

    @Override
    public void init() {
        throw new UnsupportedOperationException("Initializing a snapshot read model is not supported");
    }

    @Override
    public boolean isInitialized() {
        return true;
    }

    @Override
    public void reset() {
        throw new UnsupportedOperationException("Resetting a snapshot read model is not supported");
    }

    @Override
    public void delete() {
        throw new UnsupportedOperationException("Deleting a snapshot read model is not supported");
    }
}
