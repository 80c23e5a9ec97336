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

import io.github.suppierk.blocks.Suspicious;
import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.specification.Specification;
import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.integration.PublicationResult;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reference {@link Repository} and {@link UnitOfWork} keeping aggregates in memory.
 *
 * <p>Added aggregates stay invisible to {@link #findById(Serializable)} and {@link
 * #find(Specification)} until {@link #saveEntities()}. Aggregates returned by this repository are
 * tracked, so that their pending events are dispatched on the next {@link #saveEntities()} together
 * with events of the added ones, in the order the aggregates were added or loaded.
 *
 * <p>Loaded aggregates are the stored instances themselves: modifications are visible immediately,
 * which is acceptable for tests and demos only.
 *
 * @param <A> is the type of the aggregate
 * @param <ID> is the type of the aggregate identifier
 */
public class InMemoryRepository<A extends AggregateRoot<ID>, ID extends Serializable>
    extends Suspicious implements Repository<A, ID>, UnitOfWork {
  private static final Logger log = LoggerFactory.getLogger(InMemoryRepository.class);

  private final Class<A> aggregateType;
  private final IntegrationEventPipeline pipeline;

  private final Map<ID, A> committed = new LinkedHashMap<>();
  private final List<A> staged = new ArrayList<>();
  private final List<A> tracked = new ArrayList<>();

  /**
   * @param aggregateType of the stored aggregates
   * @param pipeline to dispatch pending events through after commit
   */
  public InMemoryRepository(
      final Class<A> aggregateType, final IntegrationEventPipeline pipeline) {
    this.aggregateType = throwIllegalArgumentIfNull(aggregateType, "Aggregate type");
    this.pipeline = throwIllegalArgumentIfNull(pipeline, "Integration event pipeline");
  }

  @Override
  public Class<A> aggregateType() {
    return aggregateType;
  }

  @Override
  public synchronized void add(final A aggregate) {
    final A nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    final ID id = throwIllegalStateIfNull(nonNullAggregate.getId(), "Aggregate ID");

    if (committed.containsKey(id) || staged.stream().anyMatch(a -> id.equals(a.getId()))) {
      throw new IllegalStateException(
          "%s '%s' already exists".formatted(aggregateType.getSimpleName(), id));
    }

    staged.add(nonNullAggregate);
  }

  @Override
  public synchronized Optional<A> findById(final ID id) {
    final A aggregate = committed.get(throwIllegalArgumentIfNull(id, "Aggregate ID"));
    if (aggregate == null) {
      return Optional.empty();
    }

    track(aggregate);
    return Optional.of(aggregate);
  }

  @Override
  public synchronized List<A> find(final Specification<A> specification) {
    final Specification<A> nonNullSpecification =
        throwIllegalArgumentIfNull(specification, "Specification");

    final List<A> found =
        committed.values().stream().filter(nonNullSpecification::isSatisfiedBy).toList();
    found.forEach(this::track);
    return found;
  }

  /**
   * @return number of committed aggregates
   */
  public synchronized int size() {
    return committed.size();
  }

  @Override
  public UnitOfWork unitOfWork() {
    return this;
  }

  @Override
  public CompletableFuture<PublicationResult> saveEntities() {
    final List<A> toDispatch = commit();

    CompletableFuture<PublicationResult> chain =
        CompletableFuture.completedFuture(PublicationResult.empty());
    for (A aggregate : toDispatch) {
      chain = chain.thenCompose(result -> pipeline.dispatch(aggregate).thenApply(result::merge));
    }

    return chain;
  }

  private synchronized List<A> commit() {
    for (A aggregate : staged) {
      committed.put(aggregate.getId(), aggregate);
    }

    final List<A> toDispatch = new ArrayList<>(staged);
    for (A aggregate : tracked) {
      if (toDispatch.stream().noneMatch(a -> a == aggregate)) {
        toDispatch.add(aggregate);
      }
    }

    log.debug(
        "Committed {} new and {} loaded {} aggregate(s)",
        staged.size(),
        toDispatch.size() - staged.size(),
        aggregateType.getSimpleName());

    staged.clear();
    tracked.clear();
    return toDispatch;
  }

  private void track(final A aggregate) {
    if (tracked.stream().noneMatch(a -> a == aggregate)) {
      tracked.add(aggregate);
    }
  }
}
