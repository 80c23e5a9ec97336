package io.github.suppierk.blocks.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.DomainEvent;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IntegrationEventPipelineTest {
  record AccountOpened(UUID eventId, Instant occurredAt, String owner) implements DomainEvent {}

  record AccountAudited(UUID eventId, Instant occurredAt) implements DomainEvent {}

  record AccountClosed(UUID eventId, Instant occurredAt, String reason) implements DomainEvent {}

  record AccountOpenedIntegrationEvent(UUID messageId, Instant occurredAt, String owner)
      implements IntegrationEvent {}

  record AccountClosedIntegrationEvent(UUID messageId, Instant occurredAt, String reason)
      implements IntegrationEvent {}

  static final class Account extends AggregateRoot<UUID> {
    Account() {
      super(UUID.randomUUID());
    }

    void open(final String owner) {
      raiseDomainEvent(new AccountOpened(UUID.randomUUID(), Instant.now(), owner));
    }

    void audit() {
      raiseDomainEvent(new AccountAudited(UUID.randomUUID(), Instant.now()));
    }

    void close(final String reason) {
      raiseDomainEvent(new AccountClosed(UUID.randomUUID(), Instant.now(), reason));
    }
  }

  /** Records publications, failing the first {@code failures} attempts. */
  static class RecordingEventBus implements EventBus {
    final List<IntegrationEvent> published = new CopyOnWriteArrayList<>();
    final AtomicInteger attempts = new AtomicInteger();
    final int failures;

    RecordingEventBus(final int failures) {
      this.failures = failures;
    }

    @Override
    public CompletableFuture<Void> publish(final IntegrationEvent event) {
      if (attempts.incrementAndGet() <= failures) {
        return CompletableFuture.failedFuture(new IllegalStateException("broker unavailable"));
      }

      published.add(event);
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public <E extends IntegrationEvent> void subscribe(
        final String eventType,
        final Class<E> eventClass,
        final IntegrationEventHandler<? super E> handler) {
      throw new UnsupportedOperationException();
    }
  }

  static IntegrationEventPipeline.Builder accountPipeline(final EventBus eventBus) {
    return IntegrationEventPipeline.builder()
        .eventBus(eventBus)
        .translator(
            AccountOpened.class,
            event ->
                new AccountOpenedIntegrationEvent(
                    event.eventId(), event.occurredAt(), event.owner()))
        .translator(
            AccountClosed.class,
            event ->
                new AccountClosedIntegrationEvent(
                    event.eventId(), event.occurredAt(), event.reason()));
  }

  @Nested
  class Dispatch {
    @Test
    void translated_events_are_published_in_order_and_internal_ones_are_skipped() {
      final var bus = new RecordingEventBus(0);
      final var pipeline = accountPipeline(bus).build();
      final var account = new Account();
      account.open("alice");
      account.audit();
      account.close("moved away");

      final var result = pipeline.dispatch(account).join();

      assertTrue(result.isSuccessful());
      assertEquals(2, result.published().size());
      assertEquals(
          List.of(AccountOpenedIntegrationEvent.class, AccountClosedIntegrationEvent.class),
          bus.published.stream().map(Object::getClass).toList());
      assertTrue(account.peekDomainEvents().isEmpty());
    }

    @Test
    void message_id_is_taken_from_domain_event() {
      final var bus = new RecordingEventBus(0);
      final var account = new Account();
      account.open("bob");
      final var domainEvent = (AccountOpened) account.peekDomainEvents().get(0);

      accountPipeline(bus).build().dispatch(account).join();

      assertEquals(domainEvent.eventId(), bus.published.get(0).messageId());
    }

    @Test
    void aggregate_without_events_publishes_nothing() {
      final var bus = new RecordingEventBus(0);

      final var result = accountPipeline(bus).build().dispatch(new Account()).join();

      assertTrue(result.published().isEmpty());
      assertEquals(0, bus.attempts.get());
    }
  }

  @Nested
  class Retries {
    @Test
    void transient_failure_is_retried() {
      final var bus = new RecordingEventBus(1);
      final var account = new Account();
      account.open("carol");

      final var result = accountPipeline(bus).maxPublishRetries(1).build().dispatch(account).join();

      assertTrue(result.isSuccessful());
      assertEquals(2, bus.attempts.get());
      assertEquals(1, bus.published.size());
    }

    @Test
    void exhausted_retries_are_recorded_without_failing_dispatch() {
      final var bus = new RecordingEventBus(3);
      final var account = new Account();
      account.open("dave");
      account.close("fraud");

      final var result = accountPipeline(bus).maxPublishRetries(1).build().dispatch(account).join();

      assertFalse(result.isSuccessful());
      assertEquals(1, result.failed().size());
      assertEquals(AccountOpenedIntegrationEvent.class, result.failed().get(0).getClass());
      assertEquals(1, result.published().size());
      assertEquals(AccountClosedIntegrationEvent.class, result.published().get(0).getClass());
    }

    @Test
    void thrown_exception_is_treated_as_failed_publication() {
      final EventBus throwingBus =
          new RecordingEventBus(0) {
            @Override
            public CompletableFuture<Void> publish(final IntegrationEvent event) {
              throw new IllegalStateException("connection refused");
            }
          };
      final var account = new Account();
      account.open("erin");

      final var result =
          accountPipeline(throwingBus).maxPublishRetries(0).build().dispatch(account).join();

      assertEquals(1, result.failed().size());
    }
  }

  @Nested
  class Configuration {
    @Test
    void duplicate_translator_throws_illegal_argument_exception() {
      final var builder = accountPipeline(new RecordingEventBus(0));

      assertThrows(
          IllegalArgumentException.class,
          () ->
              builder.translator(
                  AccountOpened.class,
                  event ->
                      new AccountOpenedIntegrationEvent(
                          event.eventId(), event.occurredAt(), event.owner())));
    }

    @Test
    void missing_event_bus_throws_illegal_state_exception() {
      assertThrows(IllegalStateException.class, () -> IntegrationEventPipeline.builder().build());
    }

    @Test
    void negative_retries_throw_illegal_argument_exception() {
      assertThrows(
          IllegalArgumentException.class,
          () -> IntegrationEventPipeline.builder().maxPublishRetries(-1));
    }

    @Test
    void translate_keeps_relative_order() {
      final var pipeline = accountPipeline(new RecordingEventBus(0)).build();
      final List<DomainEvent> events =
          List.of(
              new AccountClosed(UUID.randomUUID(), Instant.now(), "first"),
              new AccountAudited(UUID.randomUUID(), Instant.now()),
              new AccountOpened(UUID.randomUUID(), Instant.now(), "second"));

      final var translated = pipeline.translate(events);

      assertEquals(2, translated.size());
      assertEquals(AccountClosedIntegrationEvent.class, translated.get(0).getClass());
      assertEquals(AccountOpenedIntegrationEvent.class, translated.get(1).getClass());
    }
  }
}
