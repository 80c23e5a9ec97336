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

package io.github.suppierk.sample.order.domain.rules;

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import java.util.Currency;

/** Currency must be an upper-case ISO 4217 code known to the platform. */
public record CurrencyMustBeSupportedRule(String currency) implements BusinessRule {
  @Override
  public boolean isBroken() {
    if (currency == null || !currency.matches("[A-Z]{3}")) {
      return true;
    }

    return Currency.getAvailableCurrencies().stream()
        .noneMatch(available -> available.getCurrencyCode().equals(currency));
  }

  @Override
  public String message() {
    return "Currency '%s' is not supported.".formatted(currency);
  }

  @Override
  public String code() {
    return "UNSUPPORTED_CURRENCY";
  }
}
