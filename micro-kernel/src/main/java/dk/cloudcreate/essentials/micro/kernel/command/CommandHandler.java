package dk.cloudcreate.essentials.micro.kernel.command;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.kernel.definition.AggregateResult;

import java.util.Map;

/**
 * Pure function that handles a command against the current aggregate state.<br>
 * The handler decides which events the command results in and returns them together with
 * the new state (typically computed using {@link dk.cloudcreate.essentials.micro.kernel.definition.AggregateDefinition#apply(Map, Message...)}).
 * To reject a command the handler throws an exception. Returning <code>null</code> is treated as an invalid handler result
 */
@FunctionalInterface
public interface CommandHandler {
    /**
     * @param state   the current aggregate state (empty if the aggregate doesn't exist yet)
     * @param command the command
     * @return the new state and the raised events
     */
    AggregateResult handle(Map<String, Object> state, Message command);
}
