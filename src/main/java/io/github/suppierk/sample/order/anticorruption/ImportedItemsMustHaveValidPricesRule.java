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
import io.github.suppierk.sample.order.domain.Money;
import java.math.BigDecimal;
import java.util.List;

/**
 * Missing, zero and negative prices are rejected, as are prices with more fractional digits than
 * {@link Money} keeps: accepting them would round the price silently.
 */
public record ImportedItemsMustHaveValidPricesRule(List<BigDecimal> unitPrices)
    implements BusinessRule {
  @Override
  public boolean isBroken() {
    return unitPrices.stream().anyMatch(ImportedItemsMustHaveValidPricesRule::isInvalid);
  }

  private static boolean isInvalid(final BigDecimal price) {
    return price == null
        || price.signum() <= 0
        || price.stripTrailingZeros().scale() > Money.SCALE;
  }

  @Override
  public String message() {
    return "All items must have a positive unit price with at most %d decimals."
        .formatted(Money.SCALE);
  }

  @Override
  public String code() {
    return "INVALID_ITEM_PRICE";
  }
}
