package dk.cloudcreate.essentials.micro.common.messaging;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable message envelope used for Commands, Events and Queries.<br>
 * A {@link Message} consists of:
 * <ul>
 *     <li>{@link #messageId()} - the unique id of the message</li>
 *     <li>{@link #messageName()} - the type name of the message, e.g. <code>RegisterUser</code></li>
 *     <li>{@link #messageType()} - whether it is a {@link MessageType#COMMAND}, {@link MessageType#EVENT} or {@link MessageType#QUERY}</li>
 *     <li>{@link #createdAt()} - when the message was created (UTC)</li>
 *     <li>{@link #payload()} - the business data (field name to value)</li>
 *     <li>{@link #metadata()} - scalar metadata (key to {@link String}, {@link Number}, {@link Boolean} or <code>null</code>)</li>
 * </ul>
 * A {@link Message} is never mutated. Enrichment, such as {@link #withAddedMetadata(String, Object)}, returns a NEW instance:
 * <pre>{@code
 * var event = Message.event("UserWasRegistered", Map.of("id", "1", "name", "Alex"))
 *                    .withAddedMetadata("_aggregate_id", "1");
 * }</pre>
 */
public final class Message {
    private final UUID                messageId;
    private final String              messageName;
    private final MessageType         messageType;
    private final OffsetDateTime      createdAt;
    private final Map<String, Object> payload;
    private final Map<String, Object> metadata;

    private Message(UUID messageId,
                    String messageName,
                    MessageType messageType,
                    OffsetDateTime createdAt,
                    Map<String, Object> payload,
                    Map<String, Object> metadata) {
        this.messageId = requireNonNull(messageId, "No messageId provided");
        this.messageName = requireNonNull(messageName, "No messageName provided");
        requireTrue(!messageName.isBlank(), "messageName must not be blank");
        this.messageType = requireNonNull(messageType, "No messageType provided");
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        this.payload = copyOf(requireNonNull(payload, "No payload provided"));
        this.metadata = copyOf(requireScalarValues(requireNonNull(metadata, "No metadata provided")));
    }

    /**
     * Create a new {@link Message}
     *
     * @param messageId   the unique id of the message
     * @param messageName the name of the message
     * @param messageType the type of message
     * @param createdAt   the creation timestamp (will be converted to UTC)
     * @param payload     the message payload
     * @param metadata    the message metadata - all values must be scalar
     * @return the new message
     */
    public static Message of(UUID messageId,
                             String messageName,
                             MessageType messageType,
                             OffsetDateTime createdAt,
                             Map<String, ?> payload,
                             Map<String, ?> metadata) {
        return new Message(messageId,
                           messageName,
                           messageType,
                           requireNonNull(createdAt, "No createdAt provided").withOffsetSameInstant(ZoneOffset.UTC),
                           toObjectMap(payload),
                           toObjectMap(metadata));
    }

    public static Message command(String messageName, Map<String, ?> payload) {
        return create(messageName, MessageType.COMMAND, payload);
    }

    public static Message event(String messageName, Map<String, ?> payload) {
        return create(messageName, MessageType.EVENT, payload);
    }

    public static Message query(String messageName, Map<String, ?> payload) {
        return create(messageName, MessageType.QUERY, payload);
    }

    private static Message create(String messageName, MessageType messageType, Map<String, ?> payload) {
        return of(UUID.randomUUID(),
                  messageName,
                  messageType,
                  OffsetDateTime.now(Clock.systemUTC()),
                  payload,
                  Map.of());
    }

    public UUID messageId() {
        return messageId;
    }

    public String messageName() {
        return messageName;
    }

    public MessageType messageType() {
        return messageType;
    }

    public OffsetDateTime createdAt() {
        return createdAt;
    }

    /**
     * @return unmodifiable view of the payload
     */
    public Map<String, Object> payload() {
        return payload;
    }

    /**
     * @return unmodifiable view of the metadata
     */
    public Map<String, Object> metadata() {
        return metadata;
    }

    public boolean isEvent() {
        return messageType == MessageType.EVENT;
    }

    /**
     * Return a copy of this message where the metadata <code>key</code> is added (or replaced) with <code>value</code>
     *
     * @param key   the metadata key
     * @param value the scalar metadata value ({@link String}, {@link Number}, {@link Boolean} or <code>null</code>)
     * @return a NEW {@link Message} instance with the added metadata
     * @throws IllegalArgumentException in case the value isn't scalar
     */
    public Message withAddedMetadata(String key, Object value) {
        requireNonNull(key, "No metadata key provided");
        var newMetadata = new LinkedHashMap<>(metadata);
        newMetadata.put(key, value);
        return new Message(messageId, messageName, messageType, createdAt, payload, newMetadata);
    }

    /**
     * Return a copy of this message with all metadata replaced by <code>metadata</code>
     *
     * @param metadata the new metadata
     * @return a NEW {@link Message} instance
     */
    public Message withMetadata(Map<String, ?> metadata) {
        return new Message(messageId, messageName, messageType, createdAt, payload, toObjectMap(requireNonNull(metadata, "No metadata provided")));
    }

    private static Map<String, Object> toObjectMap(Map<String, ?> map) {
        return map == null ? null : new LinkedHashMap<String, Object>(map);
    }

    private static Map<String, Object> copyOf(Map<String, Object> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Map<String, Object> requireScalarValues(Map<String, Object> metadata) {
        metadata.forEach((key, value) -> {
            if (value != null && !(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException(msg("Metadata value for key '{}' must be a scalar value but was of type '{}'",
                                                       key,
                                                       value.getClass().getName()));
            }
        });
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message)) return false;
        Message that = (Message) o;
        return messageId.equals(that.messageId) &&
                messageName.equals(that.messageName) &&
                messageType == that.messageType &&
                createdAt.equals(that.createdAt) &&
                payload.equals(that.payload) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, messageName, messageType, createdAt, payload, metadata);
    }

    @Override
    public String toString() {
        return "Message{" +
                "messageId=" + messageId +
                ", messageName='" + messageName + '\'' +
                ", messageType=" + messageType +
                ", createdAt=" + createdAt +
                ", payload=" + payload +
                ", metadata=" + metadata +
                '}';
    }
}
