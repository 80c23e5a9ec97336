package io.github.suppierk.sample.order.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.suppierk.blocks.domain.rules.BusinessRuleValidationException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.Test;

class OrderFactoryTest {
  static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");
  static final OrderFactory FACTORY = new OrderFactory(Clock.fixed(NOW, ZoneOffset.UTC));
  static final Address ADDRESS = Address.of("1 Main St", "Springfield", "IL", "US", "12345");

  static CreateOrderData data(final String currency, final CreateOrderData.Line... lines) {
    return new CreateOrderData(
        "EXT-1", "customer-1", "Jane Doe", ADDRESS, currency, List.of(lines), "leave at door");
  }

  @Test
  void order_is_created_as_draft_with_all_lines() {
    final var order =
        FACTORY.create(
            data(
                "USD",
                new CreateOrderData.Line("sku-1", "Widget", Money.of("100.00", "USD"), 1),
                new CreateOrderData.Line("sku-2", "Gadget", Money.of("25.00", "USD"), 2)));

    assertEquals(OrderStatus.DRAFT, order.getStatus());
    assertEquals("EXT-1", order.getExternalOrderId());
    assertEquals("Jane Doe", order.getCustomerName());
    assertEquals(ADDRESS, order.getShippingAddress());
    assertEquals(NOW, order.getCreatedAt());
    assertEquals(2, order.getItems().size());
    assertEquals(Money.of("150.00", "USD"), order.getTotal());
    assertEquals(1, order.peekDomainEvents().size());
  }

  @Test
  void repeated_product_keeps_each_line_price_in_the_total() {
    final var order =
        FACTORY.create(
            data(
                "USD",
                new CreateOrderData.Line("sku-1", "Widget", Money.of("10.00", "USD"), 1),
                new CreateOrderData.Line("sku-1", "Widget", Money.of("140.00", "USD"), 1)));

    assertEquals(2, order.getItems().size());
    assertEquals(Money.of("150.00", "USD"), order.getTotal());
  }

  @Test
  void line_above_quantity_limit_prevents_creation() {
    final var exception =
        assertThrows(
            BusinessRuleValidationException.class,
            () ->
                FACTORY.create(
                    data(
                        "USD",
                        new CreateOrderData.Line(
                            "sku-1", "Widget", Money.of("1", "USD"), Integer.MAX_VALUE))));

    assertEquals("ITEM_QUANTITY_LIMIT_EXCEEDED", exception.getCode());
  }

  @Test
  void invalid_line_prevents_creation() {
    final var exception =
        assertThrows(
            BusinessRuleValidationException.class,
            () ->
                FACTORY.create(
                    data(
                        "USD",
                        new CreateOrderData.Line("sku-1", "Widget", Money.of("10", "USD"), 1),
                        new CreateOrderData.Line("sku-2", "Gadget", Money.of("10", "EUR"), 1))));

    assertEquals("CURRENCY_MISMATCH", exception.getCode());
  }

  @Test
  void draft_requires_customer_and_supported_currency() {
    assertEquals(
        "CUSTOMER_ID_REQUIRED",
        assertThrows(
                BusinessRuleValidationException.class,
                () -> FACTORY.createDraft(" ", ADDRESS, "USD"))
            .getCode());
    assertEquals(
        "UNSUPPORTED_CURRENCY",
        assertThrows(
                BusinessRuleValidationException.class,
                () -> FACTORY.createDraft("customer-1", ADDRESS, "XYZ"))
            .getCode());
  }

  @Test
  void null_arguments_throw_illegal_argument_exception() {
    assertThrows(IllegalArgumentException.class, () -> new OrderFactory(null));
    assertThrows(IllegalArgumentException.class, () -> FACTORY.create(null));
    assertThrows(
        IllegalArgumentException.class, () -> FACTORY.createDraft("customer-1", null, "USD"));
  }
}
