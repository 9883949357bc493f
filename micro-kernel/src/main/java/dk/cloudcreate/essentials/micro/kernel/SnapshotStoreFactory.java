package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.snapshotstore.SnapshotStore;

/**
 * Provides the {@link SnapshotStore} used by the kernel when loading aggregate state
 */
@FunctionalInterface
public interface SnapshotStoreFactory {
    SnapshotStore create();

    /**
     * Call {@link #create()} and verify that it returned a {@link SnapshotStore}
     *
     * @return the snapshot store
     * @throws BadCollaboratorFactoryException in case the factory didn't return a {@link SnapshotStore}
     */
    default SnapshotStore requireSnapshotStore() {
        Object snapshotStore = create();
        if (!(snapshotStore instanceof SnapshotStore)) {
            throw new BadCollaboratorFactoryException(SnapshotStoreFactory.class.getSimpleName(), SnapshotStore.class);
        }
        return (SnapshotStore) snapshotStore;
    }
}
