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

/**
 * Caps the quantity of a single order line.
 *
 * @param productId of the line
 * @param currentQuantity already on the line, {@code 0} for a new line
 * @param addedQuantity requested on top of the current quantity
 */
public record ItemQuantityMustNotExceedLimitRule(
    String productId, int currentQuantity, int addedQuantity) implements BusinessRule {
  public static final int MAX_QUANTITY = 10_000;

  @Override
  public boolean isBroken() {
    return (long) currentQuantity + addedQuantity > MAX_QUANTITY;
  }

  @Override
  public String message() {
    return "Quantity of product '%s' cannot exceed %d, requested %d on top of %d."
        .formatted(productId, MAX_QUANTITY, addedQuantity, currentQuantity);
  }

  @Override
  public String code() {
    return "ITEM_QUANTITY_LIMIT_EXCEEDED";
  }
}
