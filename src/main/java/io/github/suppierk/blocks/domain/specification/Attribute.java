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

package io.github.suppierk.blocks.domain.specification;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;

/**
 * Named and typed property of {@code T} which {@link Criterion}s refer to.
 *
 * <p>The same attribute serves two audiences:
 *
 * <ul>
 *   <li>In-memory evaluation reads the value via {@link #accessor()}.
 *   <li>Storage adapters translate the criterion using {@link #name()} and {@link #type()} only,
 *       for example into a jOOQ {@link org.jooq.Condition}.
 * </ul>
 *
 * <p>Attributes are expected to be declared once as {@code static final} constants next to the
 * type they describe.
 *
 * @param name of the attribute, used by storage adapters as a column name
 * @param type of the attribute value
 * @param accessor reading the value from a candidate
 * @param <T> is the type of the candidate
 * @param <V> is the type of the attribute value
 */
// @formatter:off
public record Attribute<
  T,
  V extends Comparable<? super V>
>(
  String name,
  Class<V> type,
  Function<? super T, ? extends V> accessor
) {
// @formatter:on

  public Attribute {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Attribute name cannot be blank");
    }

    if (type == null) {
      throw new IllegalArgumentException("Attribute type cannot be null");
    }

    if (accessor == null) {
      throw new IllegalArgumentException("Attribute accessor cannot be null");
    }
  }

  /**
   * @param name of the attribute
   * @param type of the attribute value
   * @param accessor reading the value from a candidate
   * @return a new attribute
   * @param <T> is the type of the candidate
   * @param <V> is the type of the attribute value
   */
  public static <T, V extends Comparable<? super V>> Attribute<T, V> of(
      final String name, final Class<V> type, final Function<? super T, ? extends V> accessor) {
    return new Attribute<>(name, type, accessor);
  }

  /**
   * @param candidate to read the value from
   * @return attribute value, can be {@code null}
   */
  public V read(final T candidate) {
    return accessor.apply(candidate);
  }

  public Criterion<T> eq(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.EQ, value);
  }

  public Criterion<T> ne(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.NE, value);
  }

  public Criterion<T> lt(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.LT, value);
  }

  public Criterion<T> le(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.LE, value);
  }

  public Criterion<T> gt(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.GT, value);
  }

  public Criterion<T> ge(final V value) {
    return new Criterion.Comparison<>(this, Criterion.Operator.GE, value);
  }

  @SafeVarargs
  public final Criterion<T> in(final V... values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null");
    }

    return in(Arrays.asList(values));
  }

  public Criterion<T> in(final Collection<? extends V> values) {
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null");
    }

    return new Criterion.In<>(this, List.copyOf(values));
  }

  public Criterion<T> isNull() {
    return new Criterion.IsNull<>(this);
  }

  public Criterion<T> isNotNull() {
    return Criterion.not(isNull());
  }
}
