package io.github.suppierk.blocks.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IdempotentIntegrationEventHandlerTest {
  record StockReserved(UUID messageId, Instant occurredAt, String sku)
      implements IntegrationEvent {}

  static final StockReserved EVENT = new StockReserved(UUID.randomUUID(), Instant.now(), "SKU-1");

  @Nested
  class Deduplication {
    @Test
    void same_message_is_handled_once_per_consumer() throws Exception {
      final var store = new InMemoryProcessedMessageStore();
      final var invocations = new AtomicInteger();
      final var handler =
          new IdempotentIntegrationEventHandler<StockReserved>(
              "warehouse", event -> invocations.incrementAndGet(), store);

      handler.handle(EVENT);
      handler.handle(EVENT);

      assertEquals(1, invocations.get());
      assertTrue(store.isProcessed("warehouse", EVENT.messageId()));
    }

    @Test
    void different_consumers_handle_same_message_independently() throws Exception {
      final var store = new InMemoryProcessedMessageStore();
      final var invocations = new AtomicInteger();

      new IdempotentIntegrationEventHandler<StockReserved>(
              "warehouse", event -> invocations.incrementAndGet(), store)
          .handle(EVENT);
      new IdempotentIntegrationEventHandler<StockReserved>(
              "billing", event -> invocations.incrementAndGet(), store)
          .handle(EVENT);

      assertEquals(2, invocations.get());
    }

    @Test
    void failed_message_can_be_redelivered() throws Exception {
      final var store = new InMemoryProcessedMessageStore();
      final var invocations = new AtomicInteger();
      final var handler =
          new IdempotentIntegrationEventHandler<StockReserved>(
              "warehouse",
              event -> {
                if (invocations.incrementAndGet() == 1) {
                  throw new IllegalStateException("temporary failure");
                }
              },
              store);

      assertThrows(IllegalStateException.class, () -> handler.handle(EVENT));
      assertFalse(store.isProcessed("warehouse", EVENT.messageId()));

      handler.handle(EVENT);

      assertEquals(2, invocations.get());
      assertTrue(store.isProcessed("warehouse", EVENT.messageId()));
    }

    @Test
    void duplicate_arriving_during_handling_fails_instead_of_being_lost() throws Exception {
      final var store = new InMemoryProcessedMessageStore();
      final var started = new CountDownLatch(1);
      final var release = new CountDownLatch(1);
      final var invocations = new AtomicInteger();
      final var handler =
          new IdempotentIntegrationEventHandler<StockReserved>(
              "warehouse",
              event -> {
                if (invocations.incrementAndGet() == 1) {
                  started.countDown();
                  release.await(5, TimeUnit.SECONDS);
                  throw new IllegalStateException("first attempt failed");
                }
              },
              store);

      final var executor = Executors.newSingleThreadExecutor();
      try {
        final var firstAttempt =
            executor.submit(
                () -> {
                  handler.handle(EVENT);
                  return null;
                });
        assertTrue(started.await(5, TimeUnit.SECONDS));

        final var duplicate =
            assertThrows(IllegalStateException.class, () -> handler.handle(EVENT));
        assertTrue(duplicate.getMessage().contains("still handling"));

        release.countDown();
        final var firstFailure = assertThrows(ExecutionException.class, firstAttempt::get);
        assertInstanceOf(IllegalStateException.class, firstFailure.getCause());
      } finally {
        executor.shutdownNow();
      }

      handler.handle(EVENT);

      assertEquals(2, invocations.get());
      assertTrue(store.isProcessed("warehouse", EVENT.messageId()));
    }
  }

  @Test
  void null_arguments_throw_illegal_argument_exception() {
    final var store = new InMemoryProcessedMessageStore();
    final IntegrationEventHandler<StockReserved> delegate = event -> {};

    assertThrows(
        IllegalArgumentException.class,
        () -> new IdempotentIntegrationEventHandler<>(null, delegate, store));
    assertThrows(
        IllegalArgumentException.class,
        () -> new IdempotentIntegrationEventHandler<>("warehouse", null, store));
    assertThrows(
        IllegalArgumentException.class,
        () -> new IdempotentIntegrationEventHandler<>("warehouse", delegate, null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new IdempotentIntegrationEventHandler<>("warehouse", delegate, store).handle(null));
  }
}
