package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.command.CommandMap;
import dk.cloudcreate.essentials.micro.kernel.definition.*;
import dk.cloudcreate.essentials.micro.kernel.pipeline.*;
import org.slf4j.*;

import java.util.*;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Dispatches a command to the aggregate that handles it:
 * <ol>
 *     <li>{@link DispatchStage#RESOLVE_DEFINITION} - resolve the (cached) {@link AggregateDefinition} for the command name</li>
 *     <li>{@link DispatchStage#LOAD_STATE} - load the aggregate state from the snapshot store (if any)</li>
 *     <li>{@link DispatchStage#RECONSTITUTE_STATE} - replay the aggregate's events onto the state</li>
 *     <li>{@link DispatchStage#HANDLE_COMMAND} - call the {@link dk.cloudcreate.essentials.micro.kernel.command.CommandHandler}</li>
 *     <li>{@link DispatchStage#PERSIST_EVENTS} - enrich and persist the raised events</li>
 * </ol>
 * A dispatch never throws for a failing step. The outcome is returned as a {@link Result}: either the
 * {@link AggregateResult} with the persisted (enriched) events, or a {@link Result.Failure} carrying the error
 * and the name of the failed step (see {@link ErrorKind#of(Result)} for classifying the failure).<br>
 * Events are only persisted in the last step, so a failed dispatch never writes anything.
 * <pre>{@code
 * var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore, () -> snapshotStore);
 * var result = dispatcher.dispatch(Message.command("RegisterUser", Map.of("id", "1", "name", "Alex")));
 * }</pre>
 * The dispatcher is stateless apart from its {@link AggregateDefinitionCache} and can be used concurrently
 */
public final class CommandDispatcher implements Function<Message, Result<AggregateResult>> {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final CommandMap                     commandMap;
    private final EventStoreFactory              eventStoreFactory;
    private final Optional<SnapshotStoreFactory> snapshotStoreFactory;
    private final AggregateDefinitionCache       definitionCache;

    @SuppressWarnings("OptionalUsedAsFieldOrParameterType")
    private CommandDispatcher(CommandMap commandMap,
                              EventStoreFactory eventStoreFactory,
                              Optional<SnapshotStoreFactory> snapshotStoreFactory,
                              AggregateDefinitionCache definitionCache) {
        this.commandMap = requireNonNull(commandMap, "No commandMap provided");
        this.eventStoreFactory = requireNonNull(eventStoreFactory, "No eventStoreFactory provided");
        this.snapshotStoreFactory = requireNonNull(snapshotStoreFactory, "No snapshotStoreFactory option provided");
        this.definitionCache = requireNonNull(definitionCache, "No definitionCache provided");
    }

    /**
     * Create a dispatcher without a snapshot store. Aggregate state is always replayed from the full event history
     */
    public static CommandDispatcher buildCommandDispatcher(CommandMap commandMap,
                                                           EventStoreFactory eventStoreFactory) {
        return builder().commandMap(commandMap)
                        .eventStoreFactory(eventStoreFactory)
                        .build();
    }

    public static CommandDispatcher buildCommandDispatcher(CommandMap commandMap,
                                                           EventStoreFactory eventStoreFactory,
                                                           SnapshotStoreFactory snapshotStoreFactory) {
        return builder().commandMap(commandMap)
                        .eventStoreFactory(eventStoreFactory)
                        .snapshotStoreFactory(snapshotStoreFactory)
                        .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dispatch the command
     *
     * @param command the command
     * @return the dispatch outcome
     */
    public Result<AggregateResult> dispatch(Message command) {
        requireNonNull(command, "No command provided");
        log.trace("Dispatching '{}' with id '{}'", command.messageName(), command.messageId());

        var pipeline = Pipeline.<Message, AggregateDefinition>startWith(DispatchStage.RESOLVE_DEFINITION.stepName(),
                                                                         message -> definitionCache.get(message.messageName(), commandMap))
                               .then(DispatchStage.LOAD_STATE.stepName(),
                                     definition -> StateLoader.loadState(snapshotStoreFactory, command, definition))
                               .then(DispatchStage.RECONSTITUTE_STATE.stepName(),
                                     state -> EventLoader.reconstituteState(state, command, definitionOf(command), eventStoreFactory))
                               .then(DispatchStage.HANDLE_COMMAND.stepName(),
                                     state -> CommandHandlerInvoker.handle(state, command, commandMap))
                               .then(DispatchStage.PERSIST_EVENTS.stepName(),
                                     aggregateResult -> {
                                         var definition = definitionOf(command);
                                         return EventPersister.persistEvents(aggregateResult,
                                                                             eventStoreFactory,
                                                                             definition,
                                                                             definition.extractAggregateId(command));
                                     });

        var result = pipeline.apply(command);
        if (result.isSuccess()) {
            log.debug("Dispatched '{}' with id '{}' resulting in {} event(s)",
                      command.messageName(),
                      command.messageId(),
                      result.get().raisedEvents().size());
        } else {
            log.debug("Dispatching '{}' with id '{}' failed in step '{}' with {}: {}",
                      command.messageName(),
                      command.messageId(),
                      result.failedStep().orElse("?"),
                      ErrorKind.of(result),
                      result.error().getMessage());
        }
        return result;
    }

    @Override
    public Result<AggregateResult> apply(Message command) {
        return dispatch(command);
    }

    private AggregateDefinition definitionOf(Message command) {
        return definitionCache.get(command.messageName(), commandMap);
    }

    public AggregateDefinitionCache definitionCache() {
        return definitionCache;
    }

    public static final class Builder {
        private CommandMap               commandMap;
        private EventStoreFactory        eventStoreFactory;
        private SnapshotStoreFactory     snapshotStoreFactory;
        private AggregateDefinitionCache definitionCache;

        public Builder commandMap(CommandMap commandMap) {
            this.commandMap = requireNonNull(commandMap, "No commandMap provided");
            return this;
        }

        public Builder eventStoreFactory(EventStoreFactory eventStoreFactory) {
            this.eventStoreFactory = requireNonNull(eventStoreFactory, "No eventStoreFactory provided");
            return this;
        }

        /**
         * Optional - without a snapshot store the aggregate state is always replayed from the full event history
         */
        public Builder snapshotStoreFactory(SnapshotStoreFactory snapshotStoreFactory) {
            this.snapshotStoreFactory = requireNonNull(snapshotStoreFactory, "No snapshotStoreFactory provided");
            return this;
        }

        /**
         * Optional - share a definition cache between dispatchers that use the same {@link CommandMap}.
         * By default each dispatcher gets its own cache
         */
        public Builder definitionCache(AggregateDefinitionCache definitionCache) {
            this.definitionCache = requireNonNull(definitionCache, "No definitionCache provided");
            return this;
        }

        public CommandDispatcher build() {
            return new CommandDispatcher(commandMap,
                                         eventStoreFactory,
                                         Optional.ofNullable(snapshotStoreFactory),
                                         definitionCache != null ? definitionCache : new AggregateDefinitionCache());
        }
    }
}
