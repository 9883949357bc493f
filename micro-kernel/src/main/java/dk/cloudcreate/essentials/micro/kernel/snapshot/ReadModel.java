package dk.cloudcreate.essentials.micro.kernel.snapshot;

import dk.cloudcreate.essentials.micro.common.messaging.Message;

/**
 * A projection target that events are stacked onto and that is persisted in batches
 */
public interface ReadModel {
    void init();

    boolean isInitialized();

    void reset();

    void delete();

    /**
     * Stack events onto the read model. Nothing is persisted until {@link #persist()} is called
     *
     * @param operation the operation to perform with the events
     * @param events    the events
     */
    void stack(String operation, Message... events);

    /**
     * Persist everything stacked since the last call to {@link #persist()}
     */
    void persist();
}
