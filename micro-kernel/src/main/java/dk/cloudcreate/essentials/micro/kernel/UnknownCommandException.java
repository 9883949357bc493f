package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.kernel.command.CommandMap;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when a command name isn't registered in the {@link CommandMap}
 */
public class UnknownCommandException extends MicroKernelException {
    public final String commandName;

    public UnknownCommandException(String commandName) {
        super(msg("Unknown message '{}'. Message name not mapped to an aggregate.", commandName));
        this.commandName = requireNonNull(commandName, "No commandName provided");
    }
}
