package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.eventstore.EventStore;

/**
 * Provides the {@link EventStore} used by the kernel. The factory is called every time a dispatch step
 * needs the event store, so it's up to the application whether it returns a shared or a new instance
 */
@FunctionalInterface
public interface EventStoreFactory {
    EventStore create();

    /**
     * Call {@link #create()} and verify that it returned an {@link EventStore}
     *
     * @return the event store
     * @throws BadCollaboratorFactoryException in case the factory didn't return an {@link EventStore}
     */
    default EventStore requireEventStore() {
        Object eventStore = create();
        if (!(eventStore instanceof EventStore)) {
            throw new BadCollaboratorFactoryException(EventStoreFactory.class.getSimpleName(), EventStore.class);
        }
        return (EventStore) eventStore;
    }
}
