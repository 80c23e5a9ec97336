package io.github.suppierk.sample.payment.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import io.github.suppierk.blocks.application.CommandResult;
import io.github.suppierk.blocks.integration.InMemoryEventBus;
import io.github.suppierk.blocks.integration.IntegrationEvent;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.persistence.InMemoryRepository;
import io.github.suppierk.sample.contracts.OrderSubmittedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentCompletedIntegrationEvent;
import io.github.suppierk.sample.contracts.PaymentFailedIntegrationEvent;
import io.github.suppierk.sample.payment.domain.Payment;
import io.github.suppierk.sample.payment.domain.PaymentId;
import io.github.suppierk.sample.payment.domain.PaymentStatus;
import io.github.suppierk.sample.payment.domain.specifications.PaymentForOrderSpecification;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PaymentCommandHandlersTest {
  InMemoryRepository<Payment, PaymentId> repository;
  List<IntegrationEvent> published;

  @BeforeEach
  void setUp() {
    final var bus = new InMemoryEventBus();
    published = new CopyOnWriteArrayList<>();
    bus.subscribe(PaymentCompletedIntegrationEvent.class, published::add);
    bus.subscribe(PaymentFailedIntegrationEvent.class, published::add);

    final var pipeline =
        PaymentIntegrationEvents.registerTranslators(IntegrationEventPipeline.builder())
            .eventBus(bus)
            .build();
    repository = new InMemoryRepository<>(Payment.class, pipeline);
  }

  Payment paymentFor(final String orderId) {
    new OrderSubmittedIntegrationEventHandler(repository, Clock.systemUTC())
        .handle(
            new OrderSubmittedIntegrationEvent(
                UUID.randomUUID(),
                Instant.now(),
                orderId,
                "customer-1",
                new BigDecimal("42.00"),
                "USD",
                1));
    return repository.find(new PaymentForOrderSpecification(orderId)).get(0);
  }

  @Test
  void completing_payment_publishes_completed_event() {
    final var payment = paymentFor("order-1");

    final var status =
        new CompletePaymentCommandHandler(repository)
            .handle(
                new CompletePaymentCommand(
                    UUID.randomUUID(), Instant.now(), payment.getId(), "TX-1"))
            .getOrThrow();

    assertEquals(PaymentStatus.COMPLETED, status);
    final var event = assertInstanceOf(PaymentCompletedIntegrationEvent.class, published.get(0));
    assertEquals("order-1", event.orderId());
    assertEquals(payment.getId().toString(), event.paymentId());
    assertEquals(0, new BigDecimal("42").compareTo(event.amount()));
    assertEquals("TX-1", event.transactionReference());
  }

  @Test
  void failing_payment_publishes_failed_event() {
    final var payment = paymentFor("order-2");

    final var status =
        new FailPaymentCommandHandler(repository)
            .handle(
                new FailPaymentCommand(
                    UUID.randomUUID(), Instant.now(), payment.getId(), "insufficient funds"))
            .getOrThrow();

    assertEquals(PaymentStatus.FAILED, status);
    final var event = assertInstanceOf(PaymentFailedIntegrationEvent.class, published.get(0));
    assertEquals("insufficient funds", event.reason());
  }

  @Test
  void completing_twice_is_rejected() {
    final var payment = paymentFor("order-3");
    final var handler = new CompletePaymentCommandHandler(repository);
    handler.handle(
        new CompletePaymentCommand(UUID.randomUUID(), Instant.now(), payment.getId(), "TX-1"));

    final var result =
        handler.handle(
            new CompletePaymentCommand(UUID.randomUUID(), Instant.now(), payment.getId(), "TX-2"));

    final var failure = assertInstanceOf(CommandResult.Failure.class, result);
    assertEquals("PAYMENT_INVALID_STATUS", failure.error().code());
    assertEquals(1, published.size());
  }
}
