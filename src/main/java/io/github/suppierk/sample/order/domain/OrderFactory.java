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

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.blocks.domain.rules.BusinessRuleChecker;
import io.github.suppierk.sample.order.domain.rules.CurrencyMustBeSupportedRule;
import io.github.suppierk.sample.order.domain.rules.CustomerIdMustBeProvidedRule;
import io.github.suppierk.sample.order.domain.rules.ItemCurrencyMustMatchOrderRule;
import io.github.suppierk.sample.order.domain.rules.ItemPriceMustBePositiveRule;
import io.github.suppierk.sample.order.domain.rules.ItemQuantityMustBePositiveRule;
import io.github.suppierk.sample.order.domain.rules.ItemQuantityMustNotExceedLimitRule;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Creates {@link Order}s, checking creation rules before the aggregate exists.
 *
 * <p>A created order carries a single pending {@code OrderCreatedDomainEvent}.
 */
public final class OrderFactory {
  private final Clock clock;

  public OrderFactory() {
    this(Clock.systemUTC());
  }

  public OrderFactory(final Clock clock) {
    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.clock = clock;
  }

  /**
   * @param customerId owning the order
   * @param shippingAddress of the order
   * @param currency of the order
   * @return empty draft order
   */
  public Order createDraft(
      final String customerId, final Address shippingAddress, final String currency) {
    if (shippingAddress == null) {
      throw new IllegalArgumentException("Shipping address cannot be null");
    }

    BusinessRuleChecker.checkRules(
        new CustomerIdMustBeProvidedRule(customerId), new CurrencyMustBeSupportedRule(currency));

    return Order.create(
        OrderId.newId(), null, customerId, null, shippingAddress, currency, null, clock);
  }

  /**
   * @param data describing the order and its items
   * @return draft order containing every item of the data
   */
  public Order create(final CreateOrderData data) {
    if (data == null) {
      throw new IllegalArgumentException("Order data cannot be null");
    }

    if (data.shippingAddress() == null) {
      throw new IllegalArgumentException("Shipping address cannot be null");
    }

    final List<BusinessRule> rules = new ArrayList<>();
    rules.add(new CustomerIdMustBeProvidedRule(data.customerId()));
    rules.add(new CurrencyMustBeSupportedRule(data.currency()));
    for (CreateOrderData.Line line : data.lines()) {
      rules.add(new ItemQuantityMustBePositiveRule(line.quantity()));
      rules.add(new ItemQuantityMustNotExceedLimitRule(line.productId(), 0, line.quantity()));
      rules.add(new ItemPriceMustBePositiveRule(line.unitPrice()));
      rules.add(new ItemCurrencyMustMatchOrderRule(data.currency(), line.unitPrice()));
    }
    BusinessRuleChecker.checkRules(rules);

    final Order order =
        Order.create(
            OrderId.newId(),
            data.externalOrderId(),
            data.customerId(),
            data.customerName(),
            data.shippingAddress(),
            data.currency(),
            data.notes(),
            clock);

    for (CreateOrderData.Line line : data.lines()) {
      order.addItem(line.productId(), line.productName(), line.unitPrice(), line.quantity());
    }

    return order;
  }
}
