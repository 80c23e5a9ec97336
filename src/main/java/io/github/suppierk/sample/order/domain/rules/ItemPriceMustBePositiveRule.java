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
import io.github.suppierk.sample.order.domain.Money;

public record ItemPriceMustBePositiveRule(Money unitPrice) implements BusinessRule {
  @Override
  public boolean isBroken() {
    return unitPrice == null || !unitPrice.isPositive();
  }

  @Override
  public String message() {
    return "Item unit price must be positive, got %s.".formatted(unitPrice);
  }

  @Override
  public String code() {
    return "INVALID_ITEM_PRICE";
  }
}
