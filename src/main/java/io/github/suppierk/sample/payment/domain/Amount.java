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

package io.github.suppierk.sample.payment.domain;

import io.github.suppierk.blocks.domain.ValueObject;
import java.io.Serial;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Locale;

/**
 * Amount to charge, as known by the Payment context.
 *
 * <p>Deliberately independent of the Order context money type.
 */
public final class Amount extends ValueObject {
  @Serial private static final long serialVersionUID = 6104593140036420447L;

  private static final int SCALE = 2;

  private final BigDecimal value;
  private final String currency;

  private Amount(final BigDecimal value, final String currency) {
    if (value == null) {
      throw new IllegalArgumentException("Amount value cannot be null");
    }

    if (currency == null || currency.isBlank()) {
      throw new IllegalArgumentException("Currency cannot be blank");
    }

    this.value = value.setScale(SCALE, RoundingMode.HALF_EVEN);
    this.currency = currency.trim().toUpperCase(Locale.ROOT);
  }

  public static Amount of(final BigDecimal value, final String currency) {
    return new Amount(value, currency);
  }

  public BigDecimal value() {
    return value;
  }

  public String currency() {
    return currency;
  }

  public boolean isPositive() {
    return value.signum() > 0;
  }

  @Override
  protected List<?> equalityComponents() {
    return List.of(value, currency);
  }

  @Override
  public String toString() {
    return value.toPlainString() + " " + currency;
  }
}
