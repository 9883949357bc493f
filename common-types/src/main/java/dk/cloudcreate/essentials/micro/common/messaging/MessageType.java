package dk.cloudcreate.essentials.micro.common.messaging;

/**
 * Discriminates the intent of a {@link Message}
 */
public enum MessageType {
    /**
     * An intent that, when handled, may result in zero or more {@link #EVENT}'s
     */
    COMMAND,
    /**
     * An immutable fact raised by a command handler and appended to an event stream
     */
    EVENT,
    QUERY
}
