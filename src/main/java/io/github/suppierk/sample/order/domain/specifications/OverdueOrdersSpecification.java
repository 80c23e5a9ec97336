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
import io.github.suppierk.sample.order.domain.OrderStatus;
import java.time.Clock;
import java.time.Duration;

/**
 * Submitted orders which have not been paid for longer than the given number of hours.
 *
 * <p>The threshold is computed from the clock every time the criterion is built.
 */
public final class OverdueOrdersSpecification implements Specification<Order> {
  private final Duration threshold;
  private final Clock clock;

  /**
   * @param hours after submission an order becomes overdue
   * @param clock providing the current time
   */
  public OverdueOrdersSpecification(final long hours, final Clock clock) {
    if (hours < 0) {
      throw new IllegalArgumentException("Hours cannot be negative");
    }

    if (clock == null) {
      throw new IllegalArgumentException("Clock cannot be null");
    }

    this.threshold = Duration.ofHours(hours);
    this.clock = clock;
  }

  @Override
  public Criterion<Order> toCriterion() {
    return Criterion.and(
        Order.STATUS.eq(OrderStatus.SUBMITTED),
        Order.SUBMITTED_AT.lt(clock.instant().minus(threshold)));
  }
}
