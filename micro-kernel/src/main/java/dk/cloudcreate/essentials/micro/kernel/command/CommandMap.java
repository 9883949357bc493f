package dk.cloudcreate.essentials.micro.kernel.command;

import dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition;
import dk.cloudcreate.essentials.shared.reflection.Reflector;

import java.util.*;
import java.util.function.Supplier;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable registry that maps a command name to its {@link CommandHandler} and to a factory
 * for the {@link AggregateDefinition} of the aggregate that handles the command:
 * <pre>{@code
 * var commandMap = CommandMap.builder()
 *                            .register("RegisterUser", User::registerUser, UserAggregateDefinition::new)
 *                            .register("ChangeUserName", User::changeUserName, UserAggregateDefinition.class)
 *                            .build();
 * }</pre>
 */
public final class CommandMap {
    private final Map<String, CommandRegistration> registrations;

    private CommandMap(Map<String, CommandRegistration> registrations) {
        this.registrations = Collections.unmodifiableMap(new LinkedHashMap<>(registrations));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param commandName the command name
     * @return the registration or {@link Optional#empty()} if no handler is registered for the command name
     */
    public Optional<CommandRegistration> get(String commandName) {
        requireNonNull(commandName, "No commandName provided");
        return Optional.ofNullable(registrations.get(commandName));
    }

    public boolean contains(String commandName) {
        return registrations.containsKey(commandName);
    }

    /**
     * @return the registered command names in registration order
     */
    public Set<String> commandNames() {
        return registrations.keySet();
    }

    @Override
    public String toString() {
        return "CommandMap" + registrations.keySet();
    }

    /**
     * A command handler and the factory of the {@link AggregateDefinition} that belongs to it
     */
    public static final class CommandRegistration {
        public final String                                  commandName;
        public final CommandHandler                          handler;
        public final Supplier<? extends AggregateDefinition> definitionFactory;

        public CommandRegistration(String commandName,
                                   CommandHandler handler,
                                   Supplier<? extends AggregateDefinition> definitionFactory) {
            this.commandName = requireNonNull(commandName, "No commandName provided");
            this.handler = requireNonNull(handler, "No handler provided");
            this.definitionFactory = requireNonNull(definitionFactory, "No definitionFactory provided");
        }

        @Override
        public String toString() {
            return "CommandRegistration{" +
                    "commandName='" + commandName + '\'' +
                    '}';
        }
    }

    public static final class Builder {
        private final Map<String, CommandRegistration> registrations = new LinkedHashMap<>();

        /**
         * Register a command
         *
         * @param commandName       the command name
         * @param handler           the command handler
         * @param definitionFactory factory for the {@link AggregateDefinition} (called at most once per command name by the kernel)
         * @return this builder instance
         * @throws IllegalArgumentException in case the command name is already registered
         */
        public Builder register(String commandName,
                                CommandHandler handler,
                                Supplier<? extends AggregateDefinition> definitionFactory) {
            requireNonNull(commandName, "No commandName provided");
            requireTrue(!commandName.isBlank(), "commandName must not be blank");
            if (registrations.containsKey(commandName)) {
                throw new IllegalArgumentException(msg("Command '{}' is already registered", commandName));
            }
            registrations.put(commandName, new CommandRegistration(commandName, handler, definitionFactory));
            return this;
        }

        /**
         * Register a command, where the {@link AggregateDefinition} is created using the default constructor of
         * <code>definitionType</code>
         *
         * @param commandName    the command name
         * @param handler        the command handler
         * @param definitionType the {@link AggregateDefinition} implementation type
         * @return this builder instance
         */
        public Builder register(String commandName,
                                CommandHandler handler,
                                Class<? extends AggregateDefinition> definitionType) {
            requireNonNull(definitionType, "No definitionType provided");
            return register(commandName, handler, () -> Reflector.reflectOn(definitionType).newInstance());
        }

        public CommandMap build() {
            return new CommandMap(registrations);
        }
    }
}
