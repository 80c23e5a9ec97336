package io.github.suppierk.sample.order.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.suppierk.blocks.application.CommandResult;
import io.github.suppierk.blocks.domain.rules.AggregateBusinessRuleValidationException;
import io.github.suppierk.blocks.integration.InMemoryEventBus;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.persistence.InMemoryRepository;
import io.github.suppierk.sample.order.anticorruption.ExternalOrderDto;
import io.github.suppierk.sample.order.anticorruption.ExternalOrderItemDto;
import io.github.suppierk.sample.order.anticorruption.ExternalOrderTranslator;
import io.github.suppierk.sample.order.domain.Money;
import io.github.suppierk.sample.order.domain.Order;
import io.github.suppierk.sample.order.domain.OrderFactory;
import io.github.suppierk.sample.order.domain.OrderId;
import io.github.suppierk.sample.order.domain.OrderStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ImportExternalOrderCommandHandlerTest {
  InMemoryRepository<Order, OrderId> repository;
  ImportExternalOrderCommandHandler handler;

  static ImportExternalOrderCommand command(final String unitPrice) {
    return new ImportExternalOrderCommand(
        UUID.randomUUID(),
        Instant.now(),
        new ExternalOrderDto(
            "EXT-1",
            "customer-1",
            "Jane Doe",
            "1 Main St",
            "Springfield",
            null,
            "US",
            "12345",
            "USD",
            List.of(
                new ExternalOrderItemDto("sku-1", "Widget", new BigDecimal(unitPrice), 2),
                new ExternalOrderItemDto("sku-2", "Gadget", new BigDecimal("10.00"), 1)),
            null));
  }

  @BeforeEach
  void setUp() {
    final var pipeline =
        OrderIntegrationEvents.registerTranslators(IntegrationEventPipeline.builder())
            .eventBus(new InMemoryEventBus())
            .build();
    repository = new InMemoryRepository<>(Order.class, pipeline);
    handler =
        new ImportExternalOrderCommandHandler(
            repository, new ExternalOrderTranslator(), new OrderFactory());
  }

  @Test
  void valid_import_persists_draft_order() {
    final var result = handler.handle(command("70.00"));

    assertTrue(result.isSuccess());
    final var order = repository.getById(result.getOrThrow());
    assertEquals(OrderStatus.DRAFT, order.getStatus());
    assertEquals("EXT-1", order.getExternalOrderId());
    assertEquals(Money.of("150.00", "USD"), order.getTotal());
    assertEquals(1, repository.size());
  }

  @Test
  void negative_price_is_rejected_and_nothing_is_persisted() {
    final var result = handler.handle(command("-5.00"));

    assertFalse(result.isSuccess());
    final var failure = assertInstanceOf(CommandResult.Failure.class, result);
    assertEquals(AggregateBusinessRuleValidationException.CODE, failure.error().code());
    assertEquals(
        List.of("INVALID_ITEM_PRICE"),
        failure.error().violations().stream().map(violation -> violation.code()).toList());
    assertEquals(0, repository.size());
  }

  @Test
  void null_collaborators_throw_illegal_argument_exception() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new ImportExternalOrderCommandHandler(null, new ExternalOrderTranslator(), null));
  }
}
