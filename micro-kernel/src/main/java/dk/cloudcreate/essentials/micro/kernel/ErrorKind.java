package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.eventstore.EventStoreException;
import dk.cloudcreate.essentials.micro.kernel.pipeline.Result;
import dk.cloudcreate.essentials.micro.snapshotstore.SnapshotStoreException;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Classification of a failed dispatch.<br>
 * Kernel exceptions and {@link EventStoreException}/{@link SnapshotStoreException}s are classified by type.
 * Any other exception is classified by the {@link DispatchStage} that failed:
 * <ul>
 *     <li>{@link DispatchStage#HANDLE_COMMAND} - {@link #HANDLER_FAILURE}</li>
 *     <li>{@link DispatchStage#RECONSTITUTE_STATE} - {@link #RECONSTITUTION_FAILURE}, as the only application code called
 *     in that stage is the {@link dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition#apply(java.util.Map, dk.cloudcreate.essentials.micro.common.messaging.Message...)} fold</li>
 *     <li>any other stage - {@link #COLLABORATOR_FAILURE}</li>
 * </ul>
 */
public enum ErrorKind {
    /**
     * The command name isn't registered in the command map
     */
    UNKNOWN_COMMAND,
    /**
     * The aggregate id or aggregate version couldn't be extracted
     */
    MISSING_REQUIRED_FIELD,
    /**
     * The command handler didn't return an aggregate result
     */
    INVALID_HANDLER_RESULT,
    /**
     * An event store, snapshot store or aggregate definition factory didn't return a usable instance
     */
    BAD_COLLABORATOR_FACTORY,
    /**
     * The event store or snapshot store failed
     */
    COLLABORATOR_FAILURE,
    /**
     * The command handler threw an exception, e.g. because it rejected the command
     */
    HANDLER_FAILURE,
    /**
     * The aggregate definition's <code>apply</code> fold threw an exception while replaying the stored events,
     * e.g. because it doesn't know a stored event
     */
    RECONSTITUTION_FAILURE;

    /**
     * Classify a failed {@link Result}
     *
     * @param failure the failed result
     * @return the error kind
     * @throws IllegalArgumentException in case <code>failure</code> is a success
     */
    public static ErrorKind of(Result<?> failure) {
        requireNonNull(failure, "No failure provided");
        if (failure.isSuccess()) {
            throw new IllegalArgumentException("Can't classify a successful result");
        }
        var error = failure.error();
        if (error instanceof UnknownCommandException) return UNKNOWN_COMMAND;
        if (error instanceof MissingRequiredFieldException) return MISSING_REQUIRED_FIELD;
        if (error instanceof InvalidHandlerResultException) return INVALID_HANDLER_RESULT;
        if (error instanceof BadCollaboratorFactoryException) return BAD_COLLABORATOR_FACTORY;
        if (error instanceof EventStoreException || error instanceof SnapshotStoreException) return COLLABORATOR_FAILURE;

        var failedStage = failure.failedStep().flatMap(DispatchStage::fromStepName).orElse(null);
        if (failedStage == DispatchStage.HANDLE_COMMAND) return HANDLER_FAILURE;
        if (failedStage == DispatchStage.RECONSTITUTE_STATE) return RECONSTITUTION_FAILURE;
        return COLLABORATOR_FAILURE;
    }
}
