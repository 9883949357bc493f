package dk.cloudcreate.essentials.micro.eventstore.metadata;

import dk.cloudcreate.essentials.micro.common.messaging.Message;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Immutable filter used to select the {@link Message}'s, loaded from an event stream, that all match the
 * {@link MetadataCriterion}'s in this matcher.<br>
 * Example:
 * <pre>{@code
 * var matcher = MetadataMatcher.empty()
 *                              .withMetadataMatch("_aggregate_id", Operator.EQUALS, "1")
 *                              .withMetadataMatch("_aggregate_version", Operator.GREATER_THAN_EQUALS, 5);
 * }</pre>
 */
public final class MetadataMatcher {
    public static final String MESSAGE_ID_PROPERTY   = "messageId";
    public static final String MESSAGE_NAME_PROPERTY = "messageName";
    public static final String MESSAGE_TYPE_PROPERTY = "messageType";
    public static final String CREATED_AT_PROPERTY   = "createdAt";

    private static final MetadataMatcher EMPTY = new MetadataMatcher(List.of());

    private final List<MetadataCriterion> criteria;

    private MetadataMatcher(List<MetadataCriterion> criteria) {
        this.criteria = List.copyOf(criteria);
    }

    /**
     * A matcher without any criteria, which matches all messages
     */
    public static MetadataMatcher empty() {
        return EMPTY;
    }

    /**
     * Return a NEW {@link MetadataMatcher} with a {@link FieldType#METADATA} criterion added
     */
    public MetadataMatcher withMetadataMatch(String field, Operator operator, Object value) {
        return withMetadataMatch(field, operator, value, FieldType.METADATA);
    }

    /**
     * Return a NEW {@link MetadataMatcher} with the criterion added
     *
     * @param field     the metadata key or message property name
     * @param operator  the comparison operator
     * @param value     the value to compare with
     * @param fieldType what the <code>field</code> refers to
     * @return a NEW {@link MetadataMatcher} containing all the criteria of this matcher plus the new criterion
     */
    public MetadataMatcher withMetadataMatch(String field, Operator operator, Object value, FieldType fieldType) {
        var newCriteria = new ArrayList<>(criteria);
        newCriteria.add(new MetadataCriterion(field, operator, value, fieldType));
        return new MetadataMatcher(newCriteria);
    }

    public List<MetadataCriterion> criteria() {
        return criteria;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /**
     * Check if the <code>message</code> matches all criteria in this matcher
     *
     * @param message the message to test
     * @return true if all criteria match (an empty matcher matches every message)
     */
    public boolean matches(Message message) {
        requireNonNull(message, "No message provided");
        return criteria.stream().allMatch(criterion -> criterion.matches(message));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataMatcher)) return false;
        return criteria.equals(((MetadataMatcher) o).criteria);
    }

    @Override
    public int hashCode() {
        return criteria.hashCode();
    }

    @Override
    public String toString() {
        return "MetadataMatcher" + criteria;
    }

    /**
     * A single criterion in a {@link MetadataMatcher}
     */
    public static final class MetadataCriterion {
        public final String    field;
        public final Operator  operator;
        public final Object    value;
        public final FieldType fieldType;

        public MetadataCriterion(String field, Operator operator, Object value, FieldType fieldType) {
            this.field = requireNonNull(field, "No field provided");
            this.operator = requireNonNull(operator, "No operator provided");
            this.fieldType = requireNonNull(fieldType, "No fieldType provided");
            if (operator == Operator.IN || operator == Operator.NOT_IN) {
                requireTrue(value instanceof Collection, msg("Operator {} requires a Collection value for field '{}'", operator, field));
                this.value = List.copyOf((Collection<?>) value);
            } else if (operator == Operator.REGEX) {
                requireTrue(value instanceof String, msg("Operator {} requires a String value for field '{}'", operator, field));
                this.value = value;
            } else {
                this.value = value;
            }
            if (fieldType == FieldType.MESSAGE_PROPERTY) {
                requireTrue(List.of(MESSAGE_ID_PROPERTY, MESSAGE_NAME_PROPERTY, MESSAGE_TYPE_PROPERTY, CREATED_AT_PROPERTY).contains(field),
                            msg("Unsupported message property '{}'", field));
            }
        }

        boolean matches(Message message) {
            var actual = resolveField(message);
            switch (operator) {
                case EQUALS:
                    return valueEquals(actual, value);
                case NOT_EQUALS:
                    return !valueEquals(actual, value);
                case GREATER_THAN:
                    return actual != null && compare(actual, value) > 0;
                case GREATER_THAN_EQUALS:
                    return actual != null && compare(actual, value) >= 0;
                case LOWER_THAN:
                    return actual != null && compare(actual, value) < 0;
                case LOWER_THAN_EQUALS:
                    return actual != null && compare(actual, value) <= 0;
                case IN:
                    return ((Collection<?>) value).stream().anyMatch(candidate -> valueEquals(actual, candidate));
                case NOT_IN:
                    return ((Collection<?>) value).stream().noneMatch(candidate -> valueEquals(actual, candidate));
                case REGEX:
                    return actual != null && Pattern.compile((String) value).matcher(actual.toString()).find();
                default:
                    throw new IllegalStateException(msg("Unsupported operator {}", operator));
            }
        }

        private Object resolveField(Message message) {
            if (fieldType == FieldType.METADATA) {
                return message.metadata().get(field);
            }
            switch (field) {
                case MESSAGE_ID_PROPERTY:
                    return message.messageId().toString();
                case MESSAGE_NAME_PROPERTY:
                    return message.messageName();
                case MESSAGE_TYPE_PROPERTY:
                    return message.messageType().name();
                default:
                    return message.createdAt();
            }
        }

        private static boolean valueEquals(Object actual, Object expected) {
            if (actual instanceof Number && expected instanceof Number) {
                return toBigDecimal((Number) actual).compareTo(toBigDecimal((Number) expected)) == 0;
            }
            return Objects.equals(actual, expected);
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private int compare(Object actual, Object expected) {
            if (actual instanceof Number && expected instanceof Number) {
                return toBigDecimal((Number) actual).compareTo(toBigDecimal((Number) expected));
            }
            if (actual instanceof Comparable && expected != null && actual.getClass().equals(expected.getClass())) {
                return ((Comparable) actual).compareTo(expected);
            }
            throw new IllegalArgumentException(msg("Cannot compare field '{}' value '{}' with '{}' using operator {}",
                                                   field,
                                                   actual,
                                                   expected,
                                                   operator));
        }

        private static BigDecimal toBigDecimal(Number number) {
            return number instanceof BigDecimal ? (BigDecimal) number : new BigDecimal(number.toString());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof MetadataCriterion)) return false;
            MetadataCriterion that = (MetadataCriterion) o;
            return field.equals(that.field) &&
                    operator == that.operator &&
                    valueEquals(value, that.value) &&
                    fieldType == that.fieldType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(field, operator, fieldType);
        }

        @Override
        public String toString() {
            return "{" +
                    "field='" + field + '\'' +
                    ", operator=" + operator +
                    ", value=" + value +
                    ", fieldType=" + fieldType +
                    '}';
        }
    }
}
