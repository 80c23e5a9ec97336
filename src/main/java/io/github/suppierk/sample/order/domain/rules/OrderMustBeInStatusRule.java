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
import io.github.suppierk.sample.order.domain.OrderStatus;
import java.util.Set;

/**
 * Guards state transitions of an order.
 *
 * @param actual status of the order
 * @param allowed statuses the transition can start from
 * @param action being attempted, used in the message
 */
public record OrderMustBeInStatusRule(OrderStatus actual, Set<OrderStatus> allowed, String action)
    implements BusinessRule {
  public OrderMustBeInStatusRule {
    allowed = Set.copyOf(allowed);
  }

  @Override
  public boolean isBroken() {
    return !allowed.contains(actual);
  }

  @Override
  public String message() {
    return "Cannot %s an order in status %s.".formatted(action, actual);
  }

  @Override
  public String code() {
    return "ORDER_INVALID_STATUS";
  }
}
