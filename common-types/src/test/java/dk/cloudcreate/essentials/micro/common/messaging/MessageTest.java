package dk.cloudcreate.essentials.micro.common.messaging;

import org.junit.jupiter.api.Test;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class MessageTest {
    @Test
    void test_creating_a_command() {
        // When
        var command = Message.command("RegisterUser", Map.of("id", "1", "name", "Alex"));

        // Then
        assertThat(command.messageName()).isEqualTo("RegisterUser");
        assertThat(command.messageType()).isEqualTo(MessageType.COMMAND);
        assertThat(command.isEvent()).isFalse();
        assertThat(command.payload()).containsEntry("id", "1").containsEntry("name", "Alex");
        assertThat(command.metadata()).isEmpty();
        assertThat(command.createdAt().getOffset()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void test_creating_a_query() {
        var query = Message.query("FindUser", Map.of("id", "1"));

        assertThat(query.messageType()).isEqualTo(MessageType.QUERY);
        assertThat(query.isEvent()).isFalse();
        assertThat(query.payload()).containsOnly(entry("id", "1"));
        assertThat(query.messageId()).isNotEqualTo(Message.query("FindUser", Map.of("id", "1")).messageId());
    }

    @Test
    void verify_withAddedMetadata_returns_a_new_message_and_leaves_the_original_untouched() {
        // Given
        var event = Message.event("UserWasRegistered", Map.of("id", "1"));

        // When
        var enrichedEvent = event.withAddedMetadata("_aggregate_id", "1")
                                 .withAddedMetadata("_aggregate_version", 1);

        // Then
        assertThat(event.metadata()).isEmpty();
        assertThat(enrichedEvent).isNotSameAs(event);
        assertThat(enrichedEvent.metadata()).containsEntry("_aggregate_id", "1")
                                            .containsEntry("_aggregate_version", 1);
        assertThat(enrichedEvent.messageId()).isEqualTo(event.messageId());
        assertThat(enrichedEvent.payload()).isEqualTo(event.payload());
        assertThat(enrichedEvent.isEvent()).isTrue();
    }

    @Test
    void verify_withAddedMetadata_replaces_an_existing_key() {
        // Given
        var event = Message.event("UserWasRegistered", Map.of()).withAddedMetadata("key", "first");

        // When
        var replaced = event.withAddedMetadata("key", "second");

        // Then
        assertThat(replaced.metadata()).hasSize(1).containsEntry("key", "second");
    }

    @Test
    void verify_non_scalar_metadata_values_are_rejected() {
        var event = Message.event("UserWasRegistered", Map.of());

        assertThatThrownBy(() -> event.withAddedMetadata("list", List.of("a", "b")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("list");
    }

    @Test
    void verify_payload_and_metadata_cannot_be_modified() {
        var event = Message.event("UserWasRegistered", new HashMap<>(Map.of("id", "1")));

        assertThatThrownBy(() -> event.payload().put("id", "2"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> event.metadata().put("key", "value"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void verify_later_changes_to_the_supplied_payload_map_are_not_visible() {
        // Given
        var payload = new HashMap<String, Object>();
        payload.put("id", "1");
        var command = Message.command("ChangeUserName", payload);

        // When
        payload.put("id", "2");

        // Then
        assertThat(command.payload()).containsEntry("id", "1");
    }

    @Test
    void test_withMetadata_replaces_all_metadata() {
        // Given
        var event = Message.event("UserWasRegistered", Map.of())
                           .withAddedMetadata("a", 1);

        // When
        var replaced = event.withMetadata(Map.of("b", true));

        // Then
        assertThat(replaced.metadata()).containsOnlyKeys("b");
    }

    @Test
    void test_two_messages_with_the_same_values_are_equal() {
        // Given
        var messageId = UUID.randomUUID();
        var createdAt = OffsetDateTime.now(ZoneOffset.UTC);

        // When
        var first  = Message.of(messageId, "Foo", MessageType.QUERY, createdAt, Map.of("x", 1), Map.of());
        var second = Message.of(messageId, "Foo", MessageType.QUERY, createdAt, Map.of("x", 1), Map.of());

        // Then
        assertThat(first).isEqualTo(second);
        assertThat(first.hashCode()).isEqualTo(second.hashCode());
        assertThat(first.withAddedMetadata("y", 2)).isNotEqualTo(second);
    }
}
