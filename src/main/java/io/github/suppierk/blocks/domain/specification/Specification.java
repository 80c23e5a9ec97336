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

/**
 * Composable, reusable predicate over {@code T}.
 *
 * <p>Concrete specifications hold their own parameters (thresholds, identifiers, clocks) and
 * produce a {@link Criterion} referencing them. Because every specification, including composed
 * ones, is expressed as a {@link Criterion}, a storage adapter can always translate it into a
 * native query instead of loading candidates into memory.
 *
 * <p>Composed specifications are lazy: {@link #toCriterion()} of the operands is invoked each time
 * the composite is evaluated, so time-dependent specifications stay accurate.
 *
 * <p>Specifications never mutate their candidates.
 *
 * @param <T> is the type of the candidate
 */
@FunctionalInterface
public interface Specification<T> {
  /**
   * @param criterion to wrap
   * @return a specification backed by the given criterion
   * @param <T> is the type of the candidate
   */
  static <T> Specification<T> of(final Criterion<T> criterion) {
    if (criterion == null) {
      throw new IllegalArgumentException("Criterion cannot be null");
    }

    return () -> criterion;
  }

  /**
   * @return predicate tree describing this specification
   */
  Criterion<T> toCriterion();

  /**
   * @param candidate to evaluate
   * @return {@code true} if candidate satisfies this specification
   * @throws IllegalArgumentException if candidate is {@code null}
   */
  default boolean isSatisfiedBy(final T candidate) {
    if (candidate == null) {
      throw new IllegalArgumentException("Candidate cannot be null");
    }

    return toCriterion().test(candidate);
  }

  /**
   * @param other specification
   * @return a specification satisfied iff both are satisfied
   */
  default Specification<T> and(final Specification<T> other) {
    final Specification<T> nonNullOther = nonNull(other);
    return () -> Criterion.and(toCriterion(), nonNullOther.toCriterion());
  }

  /**
   * @param other specification
   * @return a specification satisfied iff either is satisfied
   */
  default Specification<T> or(final Specification<T> other) {
    final Specification<T> nonNullOther = nonNull(other);
    return () -> Criterion.or(toCriterion(), nonNullOther.toCriterion());
  }

  /**
   * @return a specification satisfied iff this one is not
   */
  default Specification<T> not() {
    return () -> Criterion.not(toCriterion());
  }

  private static <T> Specification<T> nonNull(final Specification<T> specification) {
    if (specification == null) {
      throw new IllegalArgumentException("Specification cannot be null");
    }

    return specification;
  }
}
