package dk.cloudcreate.essentials.micro.snapshotstore;

import java.util.Optional;

/**
 * Narrow contract for a store of aggregate {@link Snapshot}'s.<br>
 * A {@link SnapshotStore} keeps (at most) one snapshot per aggregate type and aggregate id
 */
public interface SnapshotStore {
    /**
     * Get the latest snapshot of an aggregate
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the aggregate id
     * @return the snapshot, or {@link Optional#empty()} if no snapshot exists
     */
    Optional<Snapshot> get(String aggregateType, String aggregateId);

    /**
     * Save the snapshots, replacing any existing snapshot for the same aggregate type and id
     *
     * @param snapshots the snapshots to save
     * @throws SnapshotStoreException in case the snapshots couldn't be saved
     */
    void save(Snapshot... snapshots);

    /**
     * Remove all snapshots belonging to the given aggregate type
     *
     * @param aggregateType the aggregate type
     */
    void removeAll(String aggregateType);
}
