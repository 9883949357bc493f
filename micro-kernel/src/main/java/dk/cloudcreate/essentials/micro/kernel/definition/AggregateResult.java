package dk.cloudcreate.essentials.micro.kernel.definition;

import dk.cloudcreate.essentials.micro.common.messaging.Message;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The outcome of handling a command: the new aggregate state and the events raised by the command handler.<br>
 * Every raised event must be a {@link Message} of type {@link dk.cloudcreate.essentials.micro.common.messaging.MessageType#EVENT}
 */
public final class AggregateResult {
    private final Map<String, Object> state;
    private final List<Message>       raisedEvents;

    public AggregateResult(Map<String, ?> state, List<Message> raisedEvents) {
        this.state = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(requireNonNull(state, "No state provided")));
        requireNonNull(raisedEvents, "No raisedEvents provided");
        for (var index = 0; index < raisedEvents.size(); index++) {
            var event = raisedEvents.get(index);
            requireNonNull(event, msg("Raised event at index {} is null", index));
            if (!event.isEvent()) {
                throw new IllegalArgumentException(msg("Raised message at index {} with name '{}' must be of type EVENT but was {}",
                                                       index,
                                                       event.messageName(),
                                                       event.messageType()));
            }
        }
        this.raisedEvents = List.copyOf(raisedEvents);
    }

    public AggregateResult(Map<String, ?> state, Message... raisedEvents) {
        this(state, Arrays.asList(requireNonNull(raisedEvents, "No raisedEvents provided")));
    }

    public static AggregateResult of(Map<String, ?> state, Message... raisedEvents) {
        return new AggregateResult(state, raisedEvents);
    }

    /**
     * @return unmodifiable copy of the aggregate state after the command was handled
     */
    public Map<String, Object> state() {
        return state;
    }

    /**
     * @return the raised events in the order they were raised
     */
    public List<Message> raisedEvents() {
        return raisedEvents;
    }

    /**
     * @return a new {@link AggregateResult} with the same state and the given raised events
     */
    public AggregateResult withRaisedEvents(List<Message> raisedEvents) {
        return new AggregateResult(state, raisedEvents);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateResult)) return false;
        var that = (AggregateResult) o;
        return state.equals(that.state) && raisedEvents.equals(that.raisedEvents);
    }

    @Override
    public int hashCode() {
        return Objects.hash(state, raisedEvents);
    }

    @Override
    public String toString() {
        return "AggregateResult{" +
                "state=" + state +
                ", raisedEvents=" + raisedEvents.size() +
                '}';
    }
}
