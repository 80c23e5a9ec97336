package io.github.suppierk.sample;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.blocks.integration.InMemoryEventBus;
import io.github.suppierk.blocks.integration.InMemoryProcessedMessageStore;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.persistence.InMemoryRepository;
import io.github.suppierk.sample.contracts.OrderPaidIntegrationEvent;
import io.github.suppierk.sample.contracts.OrderSubmittedIntegrationEvent;
import io.github.suppierk.sample.order.application.AddOrderItemCommand;
import io.github.suppierk.sample.order.application.AddOrderItemCommandHandler;
import io.github.suppierk.sample.order.application.CreateOrderCommand;
import io.github.suppierk.sample.order.application.CreateOrderCommandHandler;
import io.github.suppierk.sample.order.application.OrderIntegrationEvents;
import io.github.suppierk.sample.order.application.SubmitOrderCommand;
import io.github.suppierk.sample.order.application.SubmitOrderCommandHandler;
import io.github.suppierk.sample.order.domain.Address;
import io.github.suppierk.sample.order.domain.Money;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderFactory;
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.OrderStatus;
import io.github.suppierk.sample.payment.application.CompletePaymentCommand;
import io.github.suppierk.sample.payment.application.CompletePaymentCommandHandler;
import io.github.suppierk.sample.payment.application.FailPaymentCommand;
import io.github.suppierk.sample.payment.application.FailPaymentCommandHandler;
import io.github.suppierk.sample.payment.application.PaymentIntegrationEvents;
import io.github.suppierk.sample.payment.domain.Amount;
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

class OrderPaymentCollaborationTest {
  static final Address ADDRESS = Address.of("1 Main St", "Springfield", null, "US", "12345");

  InMemoryEventBus bus;
  InMemoryRepository<Order, OrderId> orders;
  InMemoryRepository<Payment, PaymentId> payments;
  List<OrderSubmittedIntegrationEvent> submitted;
  List<OrderPaidIntegrationEvent> paid;

  @BeforeEach
  void setUp() {
    bus = new InMemoryEventBus();
    submitted = new CopyOnWriteArrayList<>();
    paid = new CopyOnWriteArrayList<>();
    bus.subscribe(OrderSubmittedIntegrationEvent.class, submitted::add);
    bus.subscribe(OrderPaidIntegrationEvent.class, paid::add);

    orders =
        new InMemoryRepository<>(
            Order.class,
            OrderIntegrationEvents.registerTranslators(IntegrationEventPipeline.builder())
                .eventBus(bus)
                .build());
    payments =
        new InMemoryRepository<>(
            Payment.class,
            PaymentIntegrationEvents.registerTranslators(IntegrationEventPipeline.builder())
                .eventBus(bus)
                .build());

    final var processedMessages = new InMemoryProcessedMessageStore();
    OrderIntegrationEvents.subscribe(bus, orders, processedMessages);
    PaymentIntegrationEvents.subscribe(bus, payments, processedMessages, Clock.systemUTC());
  }

  OrderId submitOrder(final String price) {
    final var orderId =
        new CreateOrderCommandHandler(orders, new OrderFactory())
            .handle(
                new CreateOrderCommand(
                    UUID.randomUUID(), Instant.now(), "customer-1", ADDRESS, "USD"))
            .getOrThrow();
    new AddOrderItemCommandHandler(orders)
        .handle(
            new AddOrderItemCommand(
                UUID.randomUUID(),
                Instant.now(),
                orderId,
                "sku-1",
                "Widget",
                Money.of(price, "USD"),
                1))
        .getOrThrow();
    new SubmitOrderCommandHandler(orders)
        .handle(new SubmitOrderCommand(UUID.randomUUID(), Instant.now(), orderId))
        .getOrThrow();
    return orderId;
  }

  Payment paymentOf(final OrderId orderId) {
    final var found = payments.find(new PaymentForOrderSpecification(orderId.toString()));
    assertEquals(1, found.size());
    return found.get(0);
  }

  @Test
  void submitted_order_opens_a_pending_payment_for_its_total() {
    final var orderId = submitOrder("150.00");

    final var payment = paymentOf(orderId);
    assertEquals(PaymentStatus.PENDING, payment.getStatus());
    assertEquals(Amount.of(new BigDecimal("150.00"), "USD"), payment.getAmount());
  }

  @Test
  void completed_payment_marks_order_paid() {
    final var orderId = submitOrder("150.00");
    final var payment = paymentOf(orderId);

    new CompletePaymentCommandHandler(payments)
        .handle(new CompletePaymentCommand(UUID.randomUUID(), Instant.now(), payment.getId(), "TX"))
        .getOrThrow();

    final var order = orders.getById(orderId);
    assertEquals(OrderStatus.PAID, order.getStatus());
    assertEquals(payment.getId().toString(), order.getPaymentReference());
    assertEquals(1, paid.size());
    assertEquals(orderId.toString(), paid.get(0).orderId());
  }

  @Test
  void failed_payment_cancels_order() {
    final var orderId = submitOrder("20.00");
    final var payment = paymentOf(orderId);

    new FailPaymentCommandHandler(payments)
        .handle(
            new FailPaymentCommand(UUID.randomUUID(), Instant.now(), payment.getId(), "declined"))
        .getOrThrow();

    assertEquals(OrderStatus.CANCELLED, orders.getById(orderId).getStatus());
    assertTrue(paid.isEmpty());
  }

  @Test
  void redelivered_order_submission_is_ignored() {
    final var orderId = submitOrder("150.00");
    final var event = submitted.get(0);

    bus.publish(event).join();
    bus.publish(event).join();

    assertEquals(1, payments.size());
    assertEquals(PaymentStatus.PENDING, paymentOf(orderId).getStatus());
  }
}
