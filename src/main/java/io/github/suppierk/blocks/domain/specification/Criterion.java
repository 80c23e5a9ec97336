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

import java.util.ArrayList;
import java.util.List;

/**
 * A small predicate syntax tree over {@link Attribute}s of {@code T}.
 *
 * <p>The tree is interpreted directly for in-memory evaluation and compiled by storage adapters into
 * their native query language, so that composing {@link Specification}s never degrades into an
 * in-memory-only predicate.
 *
 * <p>In-memory evaluation follows SQL three-valued logic: comparing a {@code null} attribute value
 * yields <i>unknown</i>, which {@link #test(Object)} reports as {@code false}, and which stays
 * unknown under {@link Not}. This keeps both evaluation paths in agreement.
 *
 * <p>{@link And} and {@link Or} nodes are n-ary and flattened on construction via {@link
 * #and(Criterion, Criterion)} and {@link #or(Criterion, Criterion)}: {@code (a AND b) AND c} and
 * {@code a AND (b AND c)} produce the very same tree.
 *
 * @param <T> is the type of the candidate
 */
// @formatter:off
public sealed interface Criterion<T>
permits
  Criterion.Comparison, Criterion.In, Criterion.IsNull,
  Criterion.And, Criterion.Or, Criterion.Not
{
// @formatter:on

  /**
   * @param candidate to evaluate
   * @return {@link Boolean#TRUE}, {@link Boolean#FALSE} or {@code null} when the result is unknown
   */
  Boolean evaluate(final T candidate);

  /**
   * @param candidate to evaluate
   * @return {@code true} only if the criterion is definitely satisfied
   */
  default boolean test(final T candidate) {
    return Boolean.TRUE.equals(evaluate(candidate));
  }

  /**
   * @return a criterion satisfied iff both operands are satisfied
   */
  static <T> Criterion<T> and(final Criterion<T> left, final Criterion<T> right) {
    final List<Criterion<T>> operands = new ArrayList<>();
    for (Criterion<T> operand : List.of(nonNull(left), nonNull(right))) {
      if (operand instanceof And<T> and) {
        operands.addAll(and.operands());
      } else {
        operands.add(operand);
      }
    }
    return new And<>(operands);
  }

  /**
   * @return a criterion satisfied iff either operand is satisfied
   */
  static <T> Criterion<T> or(final Criterion<T> left, final Criterion<T> right) {
    final List<Criterion<T>> operands = new ArrayList<>();
    for (Criterion<T> operand : List.of(nonNull(left), nonNull(right))) {
      if (operand instanceof Or<T> or) {
        operands.addAll(or.operands());
      } else {
        operands.add(operand);
      }
    }
    return new Or<>(operands);
  }

  /**
   * @return a criterion satisfied iff the operand is not, double negation is collapsed
   */
  static <T> Criterion<T> not(final Criterion<T> operand) {
    if (nonNull(operand) instanceof Not<T> not) {
      return not.operand();
    }

    return new Not<>(operand);
  }

  private static <T> T nonNull(final T value) {
    if (value == null) {
      throw new IllegalArgumentException("Criterion cannot be null");
    }

    return value;
  }

  /** Supported comparison operators. */
  enum Operator {
    EQ,
    NE,
    LT,
    LE,
    GT,
    GE;

    boolean matches(final int comparison) {
      return switch (this) {
        case EQ -> comparison == 0;
        case NE -> comparison != 0;
        case LT -> comparison < 0;
        case LE -> comparison <= 0;
        case GT -> comparison > 0;
        case GE -> comparison >= 0;
      };
    }
  }

  /**
   * Compares attribute value with a constant. Equality relies on {@link Comparable#compareTo} so
   * that, for instance, {@code 150.0} and {@code 150.00} are equal like in SQL.
   */
  record Comparison<T, V extends Comparable<? super V>>(
      Attribute<T, V> attribute, Operator operator, V value) implements Criterion<T> {
    public Comparison {
      nonNull(attribute);
      nonNull(operator);
      if (value == null) {
        throw new IllegalArgumentException(
            "Comparison value cannot be null, use isNull() for attribute '%s'"
                .formatted(attribute.name()));
      }
    }

    @Override
    public Boolean evaluate(final T candidate) {
      final V actual = attribute.read(candidate);
      if (actual == null) {
        return null;
      }

      return operator.matches(actual.compareTo(value));
    }
  }

  /** Checks attribute value against a list of constants. */
  record In<T, V extends Comparable<? super V>>(Attribute<T, V> attribute, List<V> values)
      implements Criterion<T> {
    public In {
      nonNull(attribute);
      values = List.copyOf(nonNull(values));
      if (values.isEmpty()) {
        throw new IllegalArgumentException(
            "Values of attribute '%s' cannot be empty".formatted(attribute.name()));
      }
    }

    @Override
    public Boolean evaluate(final T candidate) {
      final V actual = attribute.read(candidate);
      if (actual == null) {
        return null;
      }

      return values.stream().anyMatch(value -> actual.compareTo(value) == 0);
    }
  }

  /** Checks attribute value absence. */
  record IsNull<T, V extends Comparable<? super V>>(Attribute<T, V> attribute)
      implements Criterion<T> {
    public IsNull {
      nonNull(attribute);
    }

    @Override
    public Boolean evaluate(final T candidate) {
      return attribute.read(candidate) == null;
    }
  }

  /** Conjunction of two or more criteria. */
  record And<T>(List<Criterion<T>> operands) implements Criterion<T> {
    public And {
      operands = List.copyOf(nonNull(operands));
    }

    @Override
    public Boolean evaluate(final T candidate) {
      boolean unknown = false;
      for (Criterion<T> operand : operands) {
        final Boolean result = operand.evaluate(candidate);
        if (Boolean.FALSE.equals(result)) {
          return false;
        }
        unknown |= result == null;
      }
      return unknown ? null : Boolean.TRUE;
    }
  }

  /** Disjunction of two or more criteria. */
  record Or<T>(List<Criterion<T>> operands) implements Criterion<T> {
    public Or {
      operands = List.copyOf(nonNull(operands));
    }

    @Override
    public Boolean evaluate(final T candidate) {
      boolean unknown = false;
      for (Criterion<T> operand : operands) {
        final Boolean result = operand.evaluate(candidate);
        if (Boolean.TRUE.equals(result)) {
          return true;
        }
        unknown |= result == null;
      }
      return unknown ? null : Boolean.FALSE;
    }
  }

  /** Negation of a criterion. */
  record Not<T>(Criterion<T> operand) implements Criterion<T> {
    public Not {
      nonNull(operand);
    }

    @Override
    public Boolean evaluate(final T candidate) {
      final Boolean result = operand.evaluate(candidate);
      return result == null ? null : !result;
    }
  }
}
