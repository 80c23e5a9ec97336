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

/** An empty order cannot be submitted. */
public record OrderMustHaveItemsRule(int itemCount) implements BusinessRule {
  @Override
  public boolean isBroken() {
    return itemCount < 1;
  }

  @Override
  public String message() {
    return "Order must contain at least one item.";
  }

  @Override
  public String code() {
    return "ORDER_EMPTY";
  }
}
