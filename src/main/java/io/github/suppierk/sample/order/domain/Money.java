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

import io.github.suppierk.blocks.domain.ValueObject;
import java.io.Serial;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Monetary amount in a specific currency.
 *
 * <p>Amounts are kept with two fraction digits, so {@code 150}, {@code 150.0} and {@code 150.00}
 * produce equal values. Arithmetic across currencies is not supported.
 */
public final class Money extends ValueObject {
  @Serial private static final long serialVersionUID = -3519226390561932907L;

  public static final String DEFAULT_CURRENCY = "USD";
  public static final int SCALE = 2;

  private final BigDecimal amount;
  private final String currency;

  private Money(final BigDecimal amount, final String currency) {
    if (amount == null) {
      throw new IllegalArgumentException("Amount cannot be null");
    }

    if (currency == null || currency.isBlank()) {
      throw new IllegalArgumentException("Currency cannot be blank");
    }

    this.amount = amount.setScale(SCALE, RoundingMode.HALF_EVEN);
    this.currency = currency.trim().toUpperCase(Locale.ROOT);
  }

  public static Money of(final BigDecimal amount, final String currency) {
    return new Money(amount, currency);
  }

  public static Money of(final String amount, final String currency) {
    return new Money(new BigDecimal(amount), currency);
  }

  public static Money zero(final String currency) {
    return new Money(BigDecimal.ZERO, currency);
  }

  public BigDecimal amount() {
    return amount;
  }

  public String currency() {
    return currency;
  }

  public boolean isPositive() {
    return amount.signum() > 0;
  }

  public boolean hasSameCurrencyAs(final Money other) {
    return other != null && currency.equals(other.currency);
  }

  /**
   * @param other amount in the same currency
   * @return sum of both amounts
   * @throws IllegalArgumentException if currencies differ
   */
  public Money add(final Money other) {
    if (!hasSameCurrencyAs(other)) {
      throw new IllegalArgumentException(
          "Cannot add %s to %s".formatted(other, this));
    }

    return new Money(amount.add(other.amount), currency);
  }

  /**
   * @param factor to multiply by
   * @return product of this amount and the factor
   */
  public Money multiply(final int factor) {
    return new Money(amount.multiply(BigDecimal.valueOf(factor)), currency);
  }

  @Override
  protected List<?> equalityComponents() {
    return List.of(amount, currency);
  }

  @Override
  public String toString() {
    return amount.toPlainString() + " " + currency;
  }
}
