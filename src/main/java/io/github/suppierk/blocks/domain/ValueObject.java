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

package io.github.suppierk.blocks.domain;

import java.io.Serial;
import java.io.Serializable;
import java.util.List;
import java.util.StringJoiner;

/**
 * Represents a domain object which is defined by its attributes rather than by its identity.
 *
 * <p>Derived types declare the ordered list of components taking part in equality via {@link
 * #equalityComponents()}, while {@link #equals(Object)}, {@link #hashCode()} and {@link
 * #toString()} are implemented here once - derived types never write them by hand.
 *
 * <p>Value objects must be immutable: all fields must be {@code final} and no method may change
 * them after construction. Operations producing "changed" values must return new instances.
 */
public abstract class ValueObject implements Serializable {
  @Serial private static final long serialVersionUID = -2360386711632315402L;

  /**
   * Components may contain {@code null}s, in which case derived types should build the list with
   * {@link java.util.Arrays#asList(Object[])} rather than {@link List#of(Object[])}.
   *
   * @return ordered components used for equality, hashing and string representation
   */
  protected abstract List<?> equalityComponents();

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final ValueObject that = (ValueObject) o;
    return equalityComponents().equals(that.equalityComponents());
  }

  @Override
  public final int hashCode() {
    return equalityComponents().hashCode();
  }

  @Override
  public String toString() {
    final var joiner = new StringJoiner(", ", getClass().getSimpleName() + "[", "]");
    for (Object component : equalityComponents()) {
      joiner.add(String.valueOf(component));
    }
    return joiner.toString();
  }
}
