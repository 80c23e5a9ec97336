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

package io.github.suppierk.sample.order.anticorruption;

import io.github.suppierk.blocks.application.AntiCorruptionTranslator;
import io.github.suppierk.blocks.domain.rules.BusinessRuleChecker;
import io.github.suppierk.sample.order.domain.Address;
import io.github.suppierk.sample.order.domain.CreateOrderData;
import io.github.suppierk.sample.order.domain.Money;
import io.github.suppierk.sample.order.domain.rules.CurrencyMustBeSupportedRule;
import io.github.suppierk.sample.order.domain.rules.CustomerIdMustBeProvidedRule;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Translates orders of external sales channels into {@link CreateOrderData}.
 *
 * <p>Every rule is evaluated before failing, so the caller receives all problems of the payload at
 * once. Text is trimmed, blank optional text becomes {@code null}, currency is upper-cased and
 * defaults to {@value Money#DEFAULT_CURRENCY}.
 */
public final class ExternalOrderTranslator
    implements AntiCorruptionTranslator<ExternalOrderDto, CreateOrderData> {

  @Override
  public CreateOrderData translate(final ExternalOrderDto external) {
    if (external == null) {
      throw new IllegalArgumentException("External order cannot be null");
    }

    final List<ExternalOrderItemDto> items =
        external.items() == null ? List.of() : external.items();
    if (items.stream().anyMatch(Objects::isNull)) {
      throw new IllegalArgumentException("External order items cannot contain null");
    }

    final String currency = normalizeCurrency(external.currency());

    BusinessRuleChecker.validateAll(
        new ExternalOrderIdMustBeProvidedRule(external.externalOrderId()),
        new CustomerIdMustBeProvidedRule(external.customerId()),
        new ShippingAddressMustBeCompleteRule(
            external.shippingStreet(),
            external.shippingCity(),
            external.shippingCountry(),
            external.shippingZipCode()),
        new CurrencyMustBeSupportedRule(currency),
        new ImportedOrderMustHaveItemsRule(items.size()),
        new ImportedItemsMustReferenceProductsRule(
            items.stream().map(ExternalOrderItemDto::productId).toList()),
        new ImportedItemsMustHaveValidPricesRule(
            items.stream().map(ExternalOrderItemDto::unitPrice).toList()),
        new ImportedItemsMustHaveValidQuantitiesRule(
            items.stream().map(ExternalOrderItemDto::quantity).toList()));

    final Address shippingAddress =
        Address.of(
            external.shippingStreet(),
            external.shippingCity(),
            external.shippingState(),
            external.shippingCountry(),
            external.shippingZipCode());

    final List<CreateOrderData.Line> lines =
        items.stream()
            .map(
                item ->
                    new CreateOrderData.Line(
                        item.productId().trim(),
                        trimToNull(item.productName()),
                        Money.of(item.unitPrice(), currency),
                        item.quantity()))
            .toList();

    return new CreateOrderData(
        external.externalOrderId().trim(),
        external.customerId().trim(),
        trimToNull(external.customerName()),
        shippingAddress,
        currency,
        lines,
        trimToNull(external.notes()));
  }

  private static String normalizeCurrency(final String currency) {
    if (currency == null || currency.isBlank()) {
      return Money.DEFAULT_CURRENCY;
    }

    return currency.trim().toUpperCase(Locale.ROOT);
  }

  private static String trimToNull(final String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
