package dk.cloudcreate.essentials.micro.eventstore.metadata;

import dk.cloudcreate.essentials.micro.common.messaging.Message;

/**
 * Which part of a {@link Message} a {@link MetadataMatcher.MetadataCriterion} is evaluated against
 */
public enum FieldType {
    /**
     * The criterion field is a key in {@link Message#metadata()}
     */
    METADATA,
    /**
     * The criterion field is one of the message properties: {@link MetadataMatcher#MESSAGE_ID_PROPERTY},
     * {@link MetadataMatcher#MESSAGE_NAME_PROPERTY}, {@link MetadataMatcher#MESSAGE_TYPE_PROPERTY} or
     * {@link MetadataMatcher#CREATED_AT_PROPERTY}
     */
    MESSAGE_PROPERTY
}
