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
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link EventBus}, suitable for tests and for contexts deployed within the same JVM.
 *
 * <p>Each published event is routed by {@link IntegrationEvent#eventType()} and handed to its
 * subscribers in subscription order on the configured {@link Executor}. By default the executor
 * runs the delivery on the publishing thread, so the returned future is already complete when
 * {@link #publish(IntegrationEvent)} returns.
 *
 * <p>Every subscriber receives the event even if another one fails. Failures are collected into a
 * single {@link IntegrationEventHandlingException}: the first one as its cause, the rest as
 * suppressed exceptions, and the returned future completes exceptionally with it.
 */
public final class InMemoryEventBus extends Suspicious implements EventBus {
  private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

  private final ConcurrentMap<String, List<Subscription<?>>> subscriptions =
      new ConcurrentHashMap<>();
  private final Executor executor;

  /** Creates a bus delivering events on the publishing thread. */
  public InMemoryEventBus() {
    this(Runnable::run);
  }

  /**
   * @param executor to deliver events on
   * @throws IllegalArgumentException if executor is {@code null}
   */
  public InMemoryEventBus(final Executor executor) {
    this.executor = throwIllegalArgumentIfNull(executor, "Executor");
  }

  @Override
  public CompletableFuture<Void> publish(final IntegrationEvent event) {
    final IntegrationEvent nonNullEvent = throwIllegalArgumentIfNull(event, "Integration event");
    return CompletableFuture.runAsync(() -> deliver(nonNullEvent), executor);
  }

  @Override
  public <E extends IntegrationEvent> void subscribe(
      final String eventType,
      final Class<E> eventClass,
      final IntegrationEventHandler<? super E> handler) {
    final Subscription<E> subscription =
        new Subscription<>(
            throwIllegalArgumentIfNull(eventClass, "Integration event class"),
            throwIllegalArgumentIfNull(handler, "Integration event handler"));

    subscriptions
        .computeIfAbsent(
            throwIllegalArgumentIfNull(eventType, "Event type"),
            ignored -> new CopyOnWriteArrayList<>())
        .add(subscription);
  }

  private void deliver(final IntegrationEvent event) {
    final List<Subscription<?>> eventSubscriptions =
        subscriptions.getOrDefault(event.eventType(), List.of());

    if (eventSubscriptions.isEmpty()) {
      log.debug(
          "No subscribers for '{}' with message ID '{}'", event.eventType(), event.messageId());
      return;
    }

    IntegrationEventHandlingException failure = null;
    for (Subscription<?> subscription : eventSubscriptions) {
      try {
        subscription.deliver(event);
      } catch (IntegrationEventHandlingException e) {
        log.warn(
            "Subscriber failed to handle '{}' with message ID '{}'",
            event.eventType(),
            event.messageId(),
            e.getCause());

        if (failure == null) {
          failure = e;
        } else {
          failure.addSuppressed(e.getCause());
        }
      }
    }

    if (failure != null) {
      throw failure;
    }
  }

  private record Subscription<E extends IntegrationEvent>(
      Class<E> eventClass, IntegrationEventHandler<? super E> handler) {
    void deliver(final IntegrationEvent event) {
      if (!eventClass.isInstance(event)) {
        throw new IntegrationEventHandlingException(
            event,
            new ClassCastException(
                "Expected '%s' but received '%s'"
                    .formatted(eventClass.getName(), event.getClass().getName())));
      }

      try {
        handler.handle(eventClass.cast(event));
      } catch (Exception e) {
        throw new IntegrationEventHandlingException(event, e);
      }
    }
  }
}
