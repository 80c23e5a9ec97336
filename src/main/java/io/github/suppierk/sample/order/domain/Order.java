/*
 * Copyright 2024 Roman Khlebnov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.github.suppierk.sample.order.domain;

import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.specification.Attribute;
import io.github.suppierk.sample.order.domain.events.OrderCancelledDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderCreatedDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderPaidDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderShippedDomainEvent;
import io.github.suppierk.sample.order.domain.events.OrderSubmittedDomainEvent;
import io.github.suppierk.sample.order.domain.rules.ItemCurrencyMustMatchOrderRule;
import io.github.suppierk.sample.order.domain.rules.ItemPriceMustBePositiveRule;
import io.github.suppierk.sample.order.domain.rules.ItemQuantityMustBePositiveRule;
import io.github.suppierk.sample.order.domain.rules.ItemQuantityMustNotExceedLimitRule;
import io.github.suppierk.sample.order.domain.rules.OrderItemMustExistRule;
import io.github.suppierk.sample.order.domain.rules.OrderMustBeInStatusRule;
import io.github.suppierk.sample.order.domain.rules.OrderMustHaveItemsRule;
import io.github.suppierk.sample.order.domain.rules.TrackingNumberMustBeProvidedRule;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Order aggregate.
 *
 * <p>Lifecycle: {@code DRAFT -> SUBMITTED -> PAID -> SHIPPED}, with {@code CANCELLED} reachable
 * from {@code DRAFT} and {@code SUBMITTED}. {@code SHIPPED} and {@code CANCELLED} are terminal.
 *
 * <p>Orders are created by {@link OrderFactory}. Items can be changed only while the order is a
 * draft, and only through this class.
 */
public final class Order extends AggregateRoot<OrderId> {
  @Serial private static final long serialVersionUID = 2236816006307342087L;

  public static final Attribute<Order, OrderStatus> STATUS =
      Attribute.of("status", OrderStatus.class, Order::getStatus);
  public static final Attribute<Order, String> CUSTOMER_ID =
      Attribute.of("customer_id", String.class, Order::getCustomerId);
  public static final Attribute<Order, String> CURRENCY =
      Attribute.of("currency", String.class, Order::getCurrency);
  public static final Attribute<Order, BigDecimal> TOTAL_AMOUNT =
      Attribute.of("total_amount", BigDecimal.class, order -> order.getTotal().amount());
  public static final Attribute<Order, Instant> SUBMITTED_AT =
      Attribute.of("submitted_at", Instant.class, Order::getSubmittedAt);

  private final String externalOrderId;
  private final String customerId;
  private final String customerName;
  private final Address shippingAddress;
  private final String currency;
  private final String notes;
  private final Instant createdAt;
  private final List<OrderItem> items = new ArrayList<>();
  private transient Clock clock;

  private OrderStatus status;
  private Instant submittedAt;
  private String paymentReference;
  private String trackingNumber;
  private String cancellationReason;

  private Order(
      final OrderId id,
      final String externalOrderId,
      final String customerId,
      final String customerName,
      final Address shippingAddress,
      final String currency,
      final String notes,
      final Clock clock) {
    super(id);
    this.externalOrderId = externalOrderId;
    this.customerId = customerId;
    this.customerName = customerName;
    this.shippingAddress = shippingAddress;
    this.currency = currency;
    this.notes = notes;
    this.clock = clock;
    this.createdAt = clock.instant();
    this.status = OrderStatus.DRAFT;
  }

  /** Creation rules are checked by {@link OrderFactory} before calling this method. */
  static Order create(
      final OrderId id,
      final String externalOrderId,
      final String customerId,
      final String customerName,
      final Address shippingAddress,
      final String currency,
      final String notes,
      final Clock clock) {
    final Order order =
        new Order(
            id, externalOrderId, customerId, customerName, shippingAddress, currency, notes, clock);
    order.raiseDomainEvent(
        new OrderCreatedDomainEvent(
            UUID.randomUUID(), order.createdAt, id, customerId, currency));
    return order;
  }

  /**
   * Adds an item, or increases the quantity of the line with the same product and unit price. The
   * same product at another unit price gets its own line.
   *
   * @throws io.github.suppierk.blocks.domain.rules.BusinessRuleValidationException with {@code
   *     ORDER_INVALID_STATUS}, {@code INVALID_ITEM_QUANTITY}, {@code INVALID_ITEM_PRICE}, {@code
   *     CURRENCY_MISMATCH} or {@code ITEM_QUANTITY_LIMIT_EXCEEDED}
   */
  public void addItem(
      final String productId, final String productName, final Money unitPrice, final int quantity) {
    if (productId == null || productId.isBlank()) {
      throw new IllegalArgumentException("Product ID cannot be blank");
    }

    checkRules(
        new OrderMustBeInStatusRule(status, EnumSet.of(OrderStatus.DRAFT), "add items to"),
        new ItemQuantityMustBePositiveRule(quantity),
        new ItemPriceMustBePositiveRule(unitPrice),
        new ItemCurrencyMustMatchOrderRule(currency, unitPrice));

    final Optional<OrderItem> sameLine =
        items.stream()
            .filter(item -> item.getProductId().equals(productId))
            .filter(item -> item.getUnitPrice().equals(unitPrice))
            .findFirst();
    checkRule(
        new ItemQuantityMustNotExceedLimitRule(
            productId, sameLine.map(OrderItem::getQuantity).orElse(0), quantity));

    sameLine.ifPresentOrElse(
        item -> item.increaseQuantity(quantity),
        () -> items.add(new OrderItem(productId, productName, unitPrice, quantity)));
  }

  /** Removes every line of the product. */
  public void removeItem(final String productId) {
    checkRules(
        new OrderMustBeInStatusRule(status, EnumSet.of(OrderStatus.DRAFT), "remove items from"),
        new OrderItemMustExistRule(productId, findItem(productId).isPresent()));

    items.removeIf(item -> item.getProductId().equals(productId));
  }

  public void submit() {
    checkRules(
        new OrderMustBeInStatusRule(status, EnumSet.of(OrderStatus.DRAFT), "submit"),
        new OrderMustHaveItemsRule(items.size()));

    status = OrderStatus.SUBMITTED;
    submittedAt = clock.instant();
    raiseDomainEvent(
        new OrderSubmittedDomainEvent(
            UUID.randomUUID(), submittedAt, getId(), customerId, getTotal(), items.size()));
  }

  public void markPaid(final String paymentReference) {
    checkRule(new OrderMustBeInStatusRule(status, EnumSet.of(OrderStatus.SUBMITTED), "pay"));

    status = OrderStatus.PAID;
    this.paymentReference = paymentReference;
    raiseDomainEvent(
        new OrderPaidDomainEvent(UUID.randomUUID(), clock.instant(), getId(), paymentReference));
  }

  public void ship(final String trackingNumber) {
    checkRules(
        new OrderMustBeInStatusRule(status, EnumSet.of(OrderStatus.PAID), "ship"),
        new TrackingNumberMustBeProvidedRule(trackingNumber));

    status = OrderStatus.SHIPPED;
    this.trackingNumber = trackingNumber.trim();
    raiseDomainEvent(
        new OrderShippedDomainEvent(
            UUID.randomUUID(), clock.instant(), getId(), this.trackingNumber));
  }

  public void cancel(final String reason) {
    checkRule(
        new OrderMustBeInStatusRule(
            status, EnumSet.of(OrderStatus.DRAFT, OrderStatus.SUBMITTED), "cancel"));

    final OrderStatus previousStatus = status;
    status = OrderStatus.CANCELLED;
    cancellationReason = reason;
    raiseDomainEvent(
        new OrderCancelledDomainEvent(
            UUID.randomUUID(), clock.instant(), getId(), previousStatus, reason));
  }

  private Optional<OrderItem> findItem(final String productId) {
    return items.stream().filter(item -> item.getProductId().equals(productId)).findFirst();
  }

  public Money getTotal() {
    return items.stream()
        .map(OrderItem::getTotalPrice)
        .reduce(Money.zero(currency), Money::add);
  }

  public List<OrderItem> getItems() {
    return List.copyOf(items);
  }

  public OrderStatus getStatus() {
    return status;
  }

  public String getExternalOrderId() {
    return externalOrderId;
  }

  public String getCustomerId() {
    return customerId;
  }

  public String getCustomerName() {
    return customerName;
  }

  public Address getShippingAddress() {
    return shippingAddress;
  }

  public String getCurrency() {
    return currency;
  }

  public String getNotes() {
    return notes;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getSubmittedAt() {
    return submittedAt;
  }

  public String getPaymentReference() {
    return paymentReference;
  }

  public String getTrackingNumber() {
    return trackingNumber;
  }

  public String getCancellationReason() {
    return cancellationReason;
  }

  /** The clock is not a part of the serialized state, a deserialized aggregate uses UTC. */
  @Serial
  private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    clock = Clock.systemUTC();
  }
}
