package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.command.*;
import dk.cloudcreate.essentials.micro.kernel.definition.AggregateResult;

import java.util.Map;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Looks up and calls the {@link CommandHandler} registered for a command
 */
public final class CommandHandlerInvoker {
    private CommandHandlerInvoker() {
    }

    /**
     * @throws UnknownCommandException in case no handler is registered for the command name
     */
    public static CommandHandler getHandler(Message message, CommandMap commandMap) {
        requireNonNull(message, "No message provided");
        requireNonNull(commandMap, "No commandMap provided");
        return commandMap.get(message.messageName())
                         .orElseThrow(() -> new UnknownCommandException(message.messageName()))
                         .handler;
    }

    /**
     * Call the handler and verify its result
     *
     * @throws InvalidHandlerResultException in case the handler didn't return an {@link AggregateResult}
     */
    public static AggregateResult invoke(CommandHandler handler, Map<String, Object> state, Message message) {
        requireNonNull(handler, "No handler provided");
        requireNonNull(state, "No state provided");
        requireNonNull(message, "No message provided");
        Object result = handler.handle(state, message);
        if (!(result instanceof AggregateResult)) {
            throw new InvalidHandlerResultException(message.messageName(), result);
        }
        return (AggregateResult) result;
    }

    public static AggregateResult handle(Map<String, Object> state, Message message, CommandMap commandMap) {
        return invoke(getHandler(message, commandMap), state, message);
    }
}
