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

import io.github.suppierk.blocks.domain.Entity;
import java.io.Serial;
import java.util.UUID;

/**
 * Line of an {@link Order}. Only the owning order can create or modify it, which is why every
 * mutator is package-private.
 */
public final class OrderItem extends Entity<UUID> {
  @Serial private static final long serialVersionUID = -1938503553717270562L;

  private final String productId;
  private final String productName;
  private final Money unitPrice;
  private int quantity;

  OrderItem(
      final String productId, final String productName, final Money unitPrice, final int quantity) {
    super(UUID.randomUUID());
    this.productId = productId;
    this.productName = productName;
    this.unitPrice = unitPrice;
    this.quantity = quantity;
  }

  void increaseQuantity(final int delta) {
    this.quantity = Math.addExact(quantity, delta);
  }

  public String getProductId() {
    return productId;
  }

  public String getProductName() {
    return productName;
  }

  public Money getUnitPrice() {
    return unitPrice;
  }

  public int getQuantity() {
    return quantity;
  }

  public Money getTotalPrice() {
    return unitPrice.multiply(quantity);
  }
}
