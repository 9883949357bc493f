package dk.cloudcreate.essentials.micro.kernel.definition;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class AggregateResultTest {
    @Test
    void test_creating_a_result_with_events() {
        // Given
        var first  = Message.event("First", Map.of());
        var second = Message.event("Second", Map.of());

        // When
        var result = AggregateResult.of(Map.of("id", "1", "version", 2), first, second);

        // Then
        assertThat(result.state()).containsEntry("id", "1").containsEntry("version", 2);
        assertThat(result.raisedEvents()).containsExactly(first, second);
    }

    @Test
    void test_a_result_without_events() {
        var result = new AggregateResult(Map.of("id", "1"));

        assertThat(result.raisedEvents()).isEmpty();
    }

    @Test
    void verify_only_events_can_be_raised() {
        assertThatThrownBy(() -> AggregateResult.of(Map.of(), Message.event("First", Map.of()), Message.query("DoIt", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("index 1")
                .hasMessageContaining("DoIt");
        assertThatThrownBy(() -> AggregateResult.of(Map.of(), Message.command("RegisterUser", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("COMMAND");
    }

    @Test
    void verify_the_result_is_immutable() {
        // Given
        var state  = new HashMap<String, Object>(Map.of("id", "1"));
        var events = new ArrayList<>(List.of(Message.event("First", Map.of())));
        var result = new AggregateResult(state, events);

        // When
        state.put("name", "Alex");
        events.clear();

        // Then
        assertThat(result.state()).containsOnlyKeys("id");
        assertThat(result.raisedEvents()).hasSize(1);
        assertThatThrownBy(() -> result.state().put("x", 1)).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> result.raisedEvents().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void test_withRaisedEvents_keeps_the_state() {
        var result   = AggregateResult.of(Map.of("id", "1"), Message.event("First", Map.of()));
        var replaced = result.withRaisedEvents(List.of(Message.event("Second", Map.of())));

        assertThat(replaced.state()).isEqualTo(result.state());
        assertThat(replaced.raisedEvents()).extracting(Message::messageName).containsExactly("Second");
    }
}
