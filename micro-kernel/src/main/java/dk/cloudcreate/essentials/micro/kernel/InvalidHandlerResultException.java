package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.kernel.definition.AggregateResult;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a command handler returns something other than an {@link AggregateResult}
 */
public class InvalidHandlerResultException extends MicroKernelException {
    public final String commandName;

    public InvalidHandlerResultException(String commandName, Object actualResult) {
        super(msg("Invalid aggregate result returned by the handler of '{}'. Expected an {} but got '{}'",
                  commandName,
                  AggregateResult.class.getSimpleName(),
                  actualResult == null ? "null" : actualResult.getClass().getName()));
        this.commandName = commandName;
    }
}
