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

package io.github.suppierk.sample.order.domain.specifications;

import io.github.suppierk.blocks.domain.specification.Criterion;
import io.github.suppierk.blocks.domain.specification.Specification;
import io.github.suppierk.sample.order.domain.Order;
import java.math.BigDecimal;

/** Orders whose total is at least the given amount, regardless of currency. */
public final class MinimumOrderValueSpecification implements Specification<Order> {
  private final BigDecimal minimum;

  public MinimumOrderValueSpecification(final BigDecimal minimum) {
    if (minimum == null) {
      throw new IllegalArgumentException("Minimum cannot be null");
    }

    this.minimum = minimum;
  }

  @Override
  public Criterion<Order> toCriterion() {
    return Order.TOTAL_AMOUNT.ge(minimum);
  }
}
