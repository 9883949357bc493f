package dk.cloudcreate.essentials.micro.kernel;

import dk.cloudcreate.essentials.micro.common.messaging.Message;
import dk.cloudcreate.essentials.micro.eventstore.*;
import dk.cloudcreate.essentials.micro.kernel.command.CommandMap;
import dk.cloudcreate.essentials.micro.kernel.definition.*;
import dk.cloudcreate.essentials.micro.kernel.test_data.*;
import dk.cloudcreate.essentials.micro.snapshotstore.*;
import org.junit.jupiter.api.*;

import java.io.IOException;
import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;

import static dk.cloudcreate.essentials.micro.kernel.definition.AbstractAggregateDefinition.*;
import static dk.cloudcreate.essentials.micro.kernel.test_data.SneakyThrow.sneakyThrow;
import static org.assertj.core.api.Assertions.*;

class CommandDispatcherTest {
    private InMemoryEventStore    eventStore;
    private InMemorySnapshotStore snapshotStore;
    private AtomicInteger         createdDefinitions;
    private CommandMap            commandMap;

    @BeforeEach
    void setup() {
        eventStore = new InMemoryEventStore();
        snapshotStore = new InMemorySnapshotStore();
        createdDefinitions = new AtomicInteger();
        commandMap = CommandMap.builder()
                               .register(User.REGISTER_USER, User::registerUser, this::createUserAggregateDefinition)
                               .register(User.CHANGE_USER_NAME, User::changeUserName, this::createUserAggregateDefinition)
                               .register("ReturnNothing", (state, command) -> null, this::createUserAggregateDefinition)
                               .build();
    }

    private AggregateDefinition createUserAggregateDefinition() {
        createdDefinitions.incrementAndGet();
        return new UserAggregateDefinition();
    }

    private static Message storedUserEvent(Message event, long version) {
        return event.withAddedMetadata(AGGREGATE_ID, "1")
                    .withAddedMetadata(AGGREGATE_TYPE, "user")
                    .withAddedMetadata(AGGREGATE_VERSION, version);
    }

    private static Message registerUser() {
        return Message.command(User.REGISTER_USER, Map.of("id", "1", "name", "Alex", "email", "member@x.org"));
    }

    @Test
    @DisplayName("RegisterUser creates the user-1 stream with one enriched UserWasRegistered event")
    void test_registering_a_new_user() {
        // Given
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore, () -> snapshotStore);

        // When
        var result = dispatcher.dispatch(registerUser());

        // Then
        assertThat(result.isSuccess()).isTrue();
        var aggregateResult = result.get();
        assertThat(aggregateResult.state()).containsEntry("id", "1")
                                           .containsEntry("name", "Alex")
                                           .containsEntry("email", "member@x.org")
                                           .containsEntry("version", 1L);
        assertThat(aggregateResult.raisedEvents()).hasSize(1);

        var event = aggregateResult.raisedEvents().get(0);
        assertThat(event.messageName()).isEqualTo(User.USER_WAS_REGISTERED);
        assertThat(event.payload()).containsEntry("id", "1")
                                   .containsEntry("name", "Alex")
                                   .containsEntry("email", "member@x.org");
        assertThat(event.metadata()).containsEntry(AGGREGATE_ID, "1")
                                    .containsEntry(AGGREGATE_TYPE, "user")
                                    .containsEntry(AGGREGATE_VERSION, 1L);

        assertThat(snapshotStore.calls).containsExactly("get:user/1");
        assertThat(eventStore.calls).containsExactly("hasStream:user-1", "hasStream:user-1", "create:user-1");
        assertThat(eventStore.events("user-1")).containsExactly(event);
    }

    @Test
    @DisplayName("ChangeUserName with a snapshot appends one event and returns the new name")
    void test_changing_the_user_name_of_a_snapshotted_user() {
        // Given
        var registeredEvent = Message.event(User.USER_WAS_REGISTERED, Map.of("id", "1", "name", "Alex", "email", "member@x.org"))
                                     .withAddedMetadata(AGGREGATE_ID, "1")
                                     .withAddedMetadata(AGGREGATE_TYPE, "user")
                                     .withAddedMetadata(AGGREGATE_VERSION, 1L);
        eventStore.withStream("user-1", registeredEvent);
        snapshotStore.withSnapshot(new Snapshot("user",
                                                "1",
                                                Map.of("id", "1", "name", "Alex", "version", 1),
                                                1,
                                                OffsetDateTime.now(ZoneOffset.UTC)));
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore, () -> snapshotStore);

        // When
        var result = dispatcher.dispatch(Message.command(User.CHANGE_USER_NAME, Map.of("id", "1", "name", "Sascha")));

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.get().state()).containsEntry("id", "1")
                                        .containsEntry("name", "Sascha")
                                        .containsEntry("version", 2L);
        assertThat(result.get().raisedEvents()).hasSize(1);
        var event = result.get().raisedEvents().get(0);
        assertThat(event.messageName()).isEqualTo(User.USER_NAME_WAS_CHANGED);
        assertThat(event.payload()).containsEntry("oldName", "Alex");
        assertThat(event.metadata()).containsEntry(AGGREGATE_VERSION, 2L);

        // The snapshot covers version 1, so only events from version 2 are replayed
        assertThat(eventStore.loads).hasSize(1);
        assertThat(eventStore.loads.get(0).metadataMatcher).isEqualTo(new UserAggregateDefinition().metadataMatcher("1", 2));
        assertThat(eventStore.calls).containsExactly("hasStream:user-1", "load:user-1", "hasStream:user-1", "appendTo:user-1");
        assertThat(eventStore.events("user-1")).containsExactly(registeredEvent, event);
    }

    @Test
    void verify_consecutive_commands_build_on_the_persisted_events() {
        // Given
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore);

        // When
        var registered = dispatcher.dispatch(registerUser());
        var changed    = dispatcher.apply(Message.command(User.CHANGE_USER_NAME, Map.of("id", "1", "name", "Sascha")));

        // Then
        assertThat(registered.isSuccess()).isTrue();
        assertThat(changed.isSuccess()).isTrue();
        assertThat(changed.get().state()).containsEntry("name", "Sascha").containsEntry("version", 2L);

        var persistedEvents = eventStore.events("user-1");
        assertThat(persistedEvents).extracting(Message::messageName)
                                   .containsExactly(User.USER_WAS_REGISTERED, User.USER_NAME_WAS_CHANGED);
        assertThat(persistedEvents).extracting(event -> event.metadata().get(AGGREGATE_VERSION))
                                   .containsExactly(1L, 2L);
        assertThat(eventStore.calls).containsExactly("hasStream:user-1", "hasStream:user-1", "create:user-1",
                                                     "hasStream:user-1", "load:user-1", "hasStream:user-1", "appendTo:user-1");
    }

    @Test
    void verify_an_unknown_command_fails_without_calling_any_collaborator() {
        // Given
        var eventStoreFactoryCalls = new AtomicInteger();
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap,
                                                                  () -> {
                                                                      eventStoreFactoryCalls.incrementAndGet();
                                                                      return eventStore;
                                                                  },
                                                                  () -> snapshotStore);

        // When
        var result = dispatcher.dispatch(Message.command("DeleteUser", Map.of("id", "1")));

        // Then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(UnknownCommandException.class);
        assertThat(result.failedStep()).hasValue(DispatchStage.RESOLVE_DEFINITION.stepName());
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.UNKNOWN_COMMAND);
        assertThat(eventStoreFactoryCalls.get()).isEqualTo(0);
        assertThat(snapshotStore.calls).isEmpty();
        assertThat(createdDefinitions.get()).isEqualTo(0);
    }

    @Test
    void verify_an_invalid_handler_result_fails_without_persisting() {
        // Given
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore);

        // When
        var result = dispatcher.dispatch(Message.command("ReturnNothing", Map.of("id", "1")));

        // Then
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.INVALID_HANDLER_RESULT);
        assertThat(result.failedStep()).hasValue(DispatchStage.HANDLE_COMMAND.stepName());
        assertThat(eventStore.calls).containsExactly("hasStream:user-1");
    }

    @Test
    void verify_a_rejected_command_is_a_handler_failure() {
        // Given
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore);

        // When
        var result = dispatcher.dispatch(Message.command(User.CHANGE_USER_NAME, Map.of("id", "1", "name", "Sascha")));

        // Then
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.HANDLER_FAILURE);
        assertThat(result.error()).isInstanceOf(IllegalStateException.class).hasMessageContaining("isn't registered");
        assertThat(eventStore.events("user-1")).isEmpty();
    }

    @Test
    void verify_an_undeclared_checked_exception_from_a_handler_is_returned_without_persisting() {
        // Given
        var exportingCommandMap = CommandMap.builder()
                                            .register("ExportUser",
                                                      (state, command) -> {
                                                          throw sneakyThrow(new IOException("disk gone"));
                                                      },
                                                      this::createUserAggregateDefinition)
                                            .build();
        var dispatcher = CommandDispatcher.buildCommandDispatcher(exportingCommandMap, () -> eventStore);

        // When
        var result = dispatcher.dispatch(Message.command("ExportUser", Map.of("id", "1")));

        // Then
        assertThat(result.isFailure()).isTrue();
        assertThat(result.error()).isInstanceOf(IOException.class).hasMessage("disk gone");
        assertThat(result.failedStep()).hasValue(DispatchStage.HANDLE_COMMAND.stepName());
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.HANDLER_FAILURE);
        assertThat(eventStore.calls).containsExactly("hasStream:user-1");
    }

    @Test
    void verify_a_failing_apply_during_replay_is_a_reconstitution_failure() {
        // Given
        eventStore.withStream("user-1",
                              storedUserEvent(Message.event(User.USER_WAS_REGISTERED, Map.of("id", "1", "name", "Alex", "email", "member@x.org")), 1),
                              storedUserEvent(Message.event("UserWasDeleted", Map.of("id", "1")), 2));
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore);

        // When
        var result = dispatcher.dispatch(Message.command(User.CHANGE_USER_NAME, Map.of("id", "1", "name", "Sascha")));

        // Then
        assertThat(result.error()).isInstanceOf(IllegalArgumentException.class).hasMessageContaining("UserWasDeleted");
        assertThat(result.failedStep()).hasValue(DispatchStage.RECONSTITUTE_STATE.stepName());
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.RECONSTITUTION_FAILURE);
        assertThat(eventStore.calls).containsExactly("hasStream:user-1", "load:user-1");
        assertThat(eventStore.events("user-1")).hasSize(2);
    }

    @Test
    void verify_a_missing_aggregate_id_is_reported() {
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore, () -> snapshotStore);

        var result = dispatcher.dispatch(Message.command(User.REGISTER_USER, Map.of("name", "Alex")));

        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.MISSING_REQUIRED_FIELD);
        assertThat(result.failedStep()).hasValue(DispatchStage.LOAD_STATE.stepName());
        assertThat(eventStore.wasCalled()).isFalse();
    }

    @Test
    void verify_a_bad_event_store_factory_is_reported() {
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> null);

        var result = dispatcher.dispatch(registerUser());

        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.BAD_COLLABORATOR_FACTORY);
        assertThat(result.failedStep()).hasValue(DispatchStage.RECONSTITUTE_STATE.stepName());
    }

    @Test
    void verify_an_event_store_failure_is_returned_as_a_collaborator_failure() {
        // Given
        var failingEventStore = new InMemoryEventStore() {
            @Override
            public void create(StreamName streamName, List<Message> initialEvents) {
                throw new ConcurrencyException("Stream " + streamName + " was created concurrently");
            }
        };
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> failingEventStore);

        // When
        var result = dispatcher.dispatch(registerUser());

        // Then
        assertThat(result.error()).isInstanceOf(ConcurrencyException.class);
        assertThat(result.failedStep()).hasValue(DispatchStage.PERSIST_EVENTS.stepName());
        assertThat(ErrorKind.of(result)).isEqualTo(ErrorKind.COLLABORATOR_FAILURE);
    }

    @Test
    void verify_the_aggregate_definition_is_created_once_per_command_type() {
        // Given
        var dispatcher = CommandDispatcher.buildCommandDispatcher(commandMap, () -> eventStore);

        // When
        dispatcher.dispatch(registerUser());
        var definitionAfterFirstDispatch = dispatcher.definitionCache().get(User.REGISTER_USER, commandMap);
        dispatcher.dispatch(Message.command(User.REGISTER_USER, Map.of("id", "2", "name", "Kim", "email", "kim@x.org")));

        // Then
        assertThat(createdDefinitions.get()).isEqualTo(1);
        assertThat(dispatcher.definitionCache().get(User.REGISTER_USER, commandMap)).isSameAs(definitionAfterFirstDispatch);
        assertThat(eventStore.events("user-2")).hasSize(1);
    }

    @Test
    void verify_dispatchers_can_share_a_definition_cache() {
        // Given
        var definitionCache = new AggregateDefinitionCache();
        var first = CommandDispatcher.builder()
                                     .commandMap(commandMap)
                                     .eventStoreFactory(() -> eventStore)
                                     .definitionCache(definitionCache)
                                     .build();
        var second = CommandDispatcher.builder()
                                      .commandMap(commandMap)
                                      .eventStoreFactory(() -> eventStore)
                                      .snapshotStoreFactory(() -> snapshotStore)
                                      .definitionCache(definitionCache)
                                      .build();

        // When
        first.dispatch(registerUser());
        second.dispatch(Message.command(User.REGISTER_USER, Map.of("id", "2", "name", "Kim", "email", "kim@x.org")));

        // Then
        assertThat(createdDefinitions.get()).isEqualTo(1);
        assertThat(first.definitionCache()).isSameAs(second.definitionCache());
    }

    @Test
    void verify_a_dispatcher_requires_a_command_map_and_an_event_store_factory() {
        assertThatThrownBy(() -> CommandDispatcher.builder().eventStoreFactory(() -> eventStore).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandDispatcher.builder().commandMap(commandMap).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
