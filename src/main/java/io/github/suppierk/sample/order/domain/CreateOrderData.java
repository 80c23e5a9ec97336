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

package io.github.suppierk.sample.order.domain;

import java.util.List;

/**
 * Internal contract for creating an {@link Order}, produced by anti-corruption translators and
 * consumed by {@link OrderFactory#create(CreateOrderData)}.
 *
 * @param externalOrderId identifier in the originating system, optional
 * @param customerId owner of the order
 * @param customerName display name of the customer, optional
 * @param shippingAddress where to ship the order
 * @param currency of the order
 * @param lines ordered items
 * @param notes free text, optional
 */
public record CreateOrderData(
    String externalOrderId,
    String customerId,
    String customerName,
    Address shippingAddress,
    String currency,
    List<Line> lines,
    String notes) {
  public CreateOrderData {
    lines = lines == null ? List.of() : List.copyOf(lines);
  }

  /**
   * @param productId of the item
   * @param productName of the item
   * @param unitPrice of the item
   * @param quantity of the item
   */
  public record Line(String productId, String productName, Money unitPrice, int quantity) {}
}
