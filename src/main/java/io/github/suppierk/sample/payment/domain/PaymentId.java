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

package io.github.suppierk.sample.payment.domain;

import io.github.suppierk.blocks.domain.ValueObject;
import java.io.Serial;
import java.util.List;
import java.util.UUID;

/** Identifier of a {@link Payment}. */
public final class PaymentId extends ValueObject {
  @Serial private static final long serialVersionUID = -1208370335618954021L;

  private final UUID value;

  private PaymentId(final UUID value) {
    if (value == null) {
      throw new IllegalArgumentException("Payment ID value cannot be null");
    }

    this.value = value;
  }

  public static PaymentId of(final UUID value) {
    return new PaymentId(value);
  }

  public static PaymentId newId() {
    return new PaymentId(UUID.randomUUID());
  }

  public UUID value() {
    return value;
  }

  @Override
  protected List<?> equalityComponents() {
    return List.of(value);
  }

  @Override
  public String toString() {
    return value.toString();
  }
}
