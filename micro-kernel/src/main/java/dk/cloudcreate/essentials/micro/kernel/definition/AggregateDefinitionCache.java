package dk.cloudcreate.essentials.micro.kernel.definition;

import dk.cloudcreate.essentials.micro.kernel.*;
import dk.cloudcreate.essentials.micro.kernel.command.CommandMap;
import org.slf4j.*;

import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Caches the {@link AggregateDefinition} per command name, so each definition factory registered in a
 * {@link CommandMap} is called at most once per command name for the lifetime of the cache.<br>
 * The cache is safe to share between threads. Concurrent first lookups of the same command name
 * converge on one definition instance.<br>
 * The command name is the cache key, so a cache should only be shared between dispatchers that use
 * the same {@link CommandMap}
 */
public final class AggregateDefinitionCache {
    private static final Logger log = LoggerFactory.getLogger(AggregateDefinitionCache.class);

    private final ConcurrentHashMap<String, AggregateDefinition> definitionPerCommandName = new ConcurrentHashMap<>();

    /**
     * Get (and on first lookup create) the {@link AggregateDefinition} that handles the given command
     *
     * @param commandName the command name
     * @param commandMap  the command map used to resolve the definition factory on first lookup
     * @return the cached definition
     * @throws UnknownCommandException          in case the command name isn't registered in the command map
     * @throws BadCollaboratorFactoryException in case the definition factory returned null
     */
    public AggregateDefinition get(String commandName, CommandMap commandMap) {
        requireNonNull(commandName, "No commandName provided");
        requireNonNull(commandMap, "No commandMap provided");
        return definitionPerCommandName.computeIfAbsent(commandName, _commandName -> {
            var registration = commandMap.get(_commandName)
                                         .orElseThrow(() -> new UnknownCommandException(_commandName));
            Object definition = registration.definitionFactory.get();
            if (!(definition instanceof AggregateDefinition)) {
                throw new BadCollaboratorFactoryException("AggregateDefinition factory for '" + _commandName + "'", AggregateDefinition.class);
            }
            log.debug("Created '{}' for command '{}'", definition.getClass().getSimpleName(), _commandName);
            return (AggregateDefinition) definition;
        });
    }

    /**
     * @return the number of cached definitions
     */
    public int size() {
        return definitionPerCommandName.size();
    }
}
