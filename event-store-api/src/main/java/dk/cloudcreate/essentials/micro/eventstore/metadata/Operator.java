package dk.cloudcreate.essentials.micro.eventstore.metadata;

public enum Operator {
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    GREATER_THAN_EQUALS,
    LOWER_THAN,
    LOWER_THAN_EQUALS,
    /**
     * The criterion value must be a {@link java.util.Collection}
     */
    IN,
    /**
     * The criterion value must be a {@link java.util.Collection}
     */
    NOT_IN,
    /**
     * The criterion value must be a regular expression {@link String}
     */
    REGEX
}
