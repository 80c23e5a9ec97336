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

package io.github.suppierk.blocks.persistence;

import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.specification.Specification;
import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Collection-like access to aggregates of one type.
 *
 * <p>Changes become durable only after {@link UnitOfWork#saveEntities()} of {@link #unitOfWork()}.
 *
 * @param <A> is the type of the aggregate
 * @param <ID> is the type of the aggregate identifier
 */
public interface Repository<A extends AggregateRoot<ID>, ID extends Serializable> {
  /**
   * @return type of the stored aggregates
   */
  Class<A> aggregateType();

  /**
   * Stages a new aggregate for insertion.
   *
   * @param aggregate to add, must have an identifier
   */
  void add(final A aggregate);

  /**
   * @param id of the aggregate
   * @return aggregate if it exists
   */
  Optional<A> findById(final ID id);

  /**
   * @param id of the aggregate
   * @return existing aggregate
   * @throws NotFoundException if aggregate does not exist
   */
  default A getById(final ID id) {
    return findById(id).orElseThrow(() -> NotFoundException.of(aggregateType(), id));
  }

  /**
   * @param specification to satisfy
   * @return every aggregate satisfying the specification
   */
  List<A> find(final Specification<A> specification);

  /**
   * @return unit of work committing changes made through this repository
   */
  UnitOfWork unitOfWork();
}
