package dk.cloudcreate.essentials.micro.eventstore;

import dk.cloudcreate.essentials.types.*;

/**
 * The name of an append-only event stream owned by an {@link EventStore}.<br>
 * A stream can either contain the events of a single aggregate instance (e.g. <b>user-1</b>)
 * or the events of all aggregate instances of the same type (e.g. <b>user</b>), in which case
 * the events are told apart using their metadata
 */
public class StreamName extends CharSequenceType<StreamName> implements Identifier {
    public StreamName(CharSequence value) {
        super(value);
    }

    public static StreamName of(CharSequence value) {
        return new StreamName(value);
    }
}
