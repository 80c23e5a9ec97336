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

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.sample.order.domain.rules.ItemQuantityMustNotExceedLimitRule;
import java.util.List;

/**
 * Missing, zero and negative quantities are rejected, as are quantities above {@link
 * ItemQuantityMustNotExceedLimitRule#MAX_QUANTITY}.
 */
public record ImportedItemsMustHaveValidQuantitiesRule(List<Integer> quantities)
    implements BusinessRule {
  @Override
  public boolean isBroken() {
    return quantities.stream()
        .anyMatch(
            quantity ->
                quantity == null
                    || quantity <= 0
                    || quantity > ItemQuantityMustNotExceedLimitRule.MAX_QUANTITY);
  }

  @Override
  public String message() {
    return "All items must have a quantity between 1 and %d."
        .formatted(ItemQuantityMustNotExceedLimitRule.MAX_QUANTITY);
  }

  @Override
  public String code() {
    return "INVALID_ITEM_QUANTITY";
  }
}
