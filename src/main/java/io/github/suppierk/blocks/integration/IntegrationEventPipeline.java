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

package io.github.suppierk.blocks.integration;

import io.github.suppierk.blocks.Suspicious;
import io.github.suppierk.blocks.domain.AggregateRoot;
import io.github.suppierk.blocks.domain.DomainEvent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns pending {@link DomainEvent}s of committed aggregates into {@link IntegrationEvent}s and
 * publishes them.
 *
 * <p>The pipeline is invoked by the unit of work strictly after a successful commit:
 *
 * <ol>
 *   <li>Pending events are drained from the aggregate.
 *   <li>Every event with a registered {@link DomainEventTranslator} is translated, other events are
 *       internal and are skipped.
 *   <li>Translated events are published one after another: the next publication starts only after
 *       the previous one completed, preserving the order in which the aggregate raised them.
 * </ol>
 *
 * <p>A failed publication is retried up to {@link Builder#maxPublishRetries(int)} times. If it keeps
 * failing it is logged and reported in {@link PublicationResult#failed()}, the returned future still
 * completes normally: the commit has already happened and must not be undone.
 *
 * <p>Delivery is fire-and-forget. A durable alternative would store events with {@link
 * io.github.suppierk.blocks.jooq.IntegrationEventOutbox} in the same transaction instead.
 */
public final class IntegrationEventPipeline extends Suspicious {
  private static final Logger log = LoggerFactory.getLogger(IntegrationEventPipeline.class);

  private final Map<Class<?>, DomainEventTranslator<?, ?>> translators;
  private final EventBus eventBus;
  private final int maxPublishRetries;

  private IntegrationEventPipeline(final Builder builder) {
    this.translators = Collections.unmodifiableMap(new LinkedHashMap<>(builder.translators));
    this.eventBus = throwIllegalStateIfNull(builder.eventBus, "Event bus");
    this.maxPublishRetries = builder.maxPublishRetries;
  }

  /**
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Drains pending events of the aggregate, translates and publishes them.
   *
   * @param aggregate which was just committed
   * @return future completed with the outcome of every publication, never completed exceptionally
   *     because of a publication failure
   * @throws IllegalArgumentException if aggregate is {@code null}
   */
  public CompletableFuture<PublicationResult> dispatch(final AggregateRoot<?> aggregate) {
    final AggregateRoot<?> nonNullAggregate = throwIllegalArgumentIfNull(aggregate, "Aggregate");
    return publishAll(translate(nonNullAggregate.pullDomainEvents()));
  }

  /**
   * @param domainEvents to translate
   * @return integration events in the same relative order, internal events are omitted
   */
  public List<IntegrationEvent> translate(final List<DomainEvent> domainEvents) {
    final List<IntegrationEvent> integrationEvents = new ArrayList<>();

    for (DomainEvent domainEvent : throwIllegalArgumentIfNull(domainEvents, "Domain events")) {
      final DomainEventTranslator<DomainEvent, ?> translator = translatorFor(domainEvent);

      if (translator == null) {
        log.debug(
            "'{}' has no translator and stays internal", domainEvent.getClass().getSimpleName());
        continue;
      }

      integrationEvents.add(
          throwIllegalStateIfNull(
              translator.translate(domainEvent), "Translated integration event"));
    }

    return integrationEvents;
  }

  /**
   * @param integrationEvents to publish sequentially
   * @return future completed with the outcome of every publication
   */
  public CompletableFuture<PublicationResult> publishAll(
      final List<IntegrationEvent> integrationEvents) {
    CompletableFuture<PublicationResult> chain =
        CompletableFuture.completedFuture(PublicationResult.empty());

    for (IntegrationEvent integrationEvent :
        throwIllegalArgumentIfNull(integrationEvents, "Integration events")) {
      chain =
          chain.thenCompose(
              result ->
                  publishWithRetries(integrationEvent, maxPublishRetries)
                      .thenApply(
                          published ->
                              result.merge(
                                  Boolean.TRUE.equals(published)
                                      ? new PublicationResult(List.of(integrationEvent), List.of())
                                      : new PublicationResult(
                                          List.of(), List.of(integrationEvent)))));
    }

    return chain;
  }

  @SuppressWarnings("unchecked")
  private DomainEventTranslator<DomainEvent, ?> translatorFor(final DomainEvent domainEvent) {
    return (DomainEventTranslator<DomainEvent, ?>)
        translators.get(throwIllegalArgumentIfNull(domainEvent, "Domain event").getClass());
  }

  private CompletableFuture<Boolean> publishWithRetries(
      final IntegrationEvent integrationEvent, final int retriesLeft) {
    return publishOnce(integrationEvent)
        .handle((ignored, failure) -> failure)
        .thenCompose(
            failure -> {
              if (failure == null) {
                log.debug(
                    "Published '{}' with message ID '{}'",
                    integrationEvent.eventType(),
                    integrationEvent.messageId());
                return CompletableFuture.completedFuture(true);
              }

              if (retriesLeft > 0) {
                log.warn(
                    "Retrying publication of '{}' with message ID '{}', {} attempt(s) left",
                    integrationEvent.eventType(),
                    integrationEvent.messageId(),
                    retriesLeft,
                    failure);
                return publishWithRetries(integrationEvent, retriesLeft - 1);
              }

              log.error(
                  "Failed to publish '{}' with message ID '{}'",
                  integrationEvent.eventType(),
                  integrationEvent.messageId(),
                  failure);
              return CompletableFuture.completedFuture(false);
            });
  }

  private CompletableFuture<Void> publishOnce(final IntegrationEvent integrationEvent) {
    try {
      final CompletableFuture<Void> publication = eventBus.publish(integrationEvent);
      return publication != null
          ? publication
          : CompletableFuture.failedFuture(
              new IllegalStateException("Event bus returned no publication future"));
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /** Configures {@link IntegrationEventPipeline}. */
  public static final class Builder extends Suspicious {
    private final Map<Class<?>, DomainEventTranslator<?, ?>> translators = new LinkedHashMap<>();
    private EventBus eventBus;
    private int maxPublishRetries = 1;

    private Builder() {
      // Use IntegrationEventPipeline.builder()
    }

    /**
     * Registers translator for the exact domain event class.
     *
     * @param domainEventClass to translate
     * @param translator to use
     * @return this builder
     * @param <D> is the type of the domain event
     * @throws IllegalArgumentException if the class already has a translator
     */
    public <D extends DomainEvent> Builder translator(
        final Class<D> domainEventClass,
        final DomainEventTranslator<D, ? extends IntegrationEvent> translator) {
      final Class<D> nonNullClass =
          throwIllegalArgumentIfNull(domainEventClass, "Domain event class");

      if (translators.putIfAbsent(
              nonNullClass, throwIllegalArgumentIfNull(translator, "Domain event translator"))
          != null) {
        throw new IllegalArgumentException(
            "Translator for '%s' is already registered".formatted(nonNullClass.getSimpleName()));
      }

      return this;
    }

    /**
     * @param eventBus to publish to
     * @return this builder
     */
    public Builder eventBus(final EventBus eventBus) {
      this.eventBus = throwIllegalArgumentIfNull(eventBus, "Event bus");
      return this;
    }

    /**
     * @param maxPublishRetries number of additional attempts after a failed publication
     * @return this builder
     * @throws IllegalArgumentException if the number is negative
     */
    public Builder maxPublishRetries(final int maxPublishRetries) {
      if (maxPublishRetries < 0) {
        throw new IllegalArgumentException("Max publish retries cannot be negative");
      }

      this.maxPublishRetries = maxPublishRetries;
      return this;
    }

    /**
     * @return configured pipeline
     * @throws IllegalStateException if event bus was not set
     */
    public IntegrationEventPipeline build() {
      return new IntegrationEventPipeline(this);
    }
  }
}
