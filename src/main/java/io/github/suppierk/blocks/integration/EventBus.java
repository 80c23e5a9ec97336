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

import java.util.concurrent.CompletableFuture;

/**
 * Transport of {@link IntegrationEvent}s between contexts.
 *
 * <p>Delivery is at-least-once and asynchronous from the publisher's point of view; subscribers must
 * be idempotent.
 */
public interface EventBus {
  /**
   * @param event to deliver to every subscriber of its {@link IntegrationEvent#eventType()}
   * @return future completed once the event was handed over, completed exceptionally if delivery
   *     failed
   */
  CompletableFuture<Void> publish(final IntegrationEvent event);

  /**
   * Subscribes a handler to events of the given class, routed by {@link
   * IntegrationEvent#eventTypeOf(Class)}.
   *
   * @param eventClass to receive
   * @param handler to invoke
   * @param <E> is the type of the event
   */
  default <E extends IntegrationEvent> void subscribe(
      final Class<E> eventClass, final IntegrationEventHandler<? super E> handler) {
    subscribe(IntegrationEvent.eventTypeOf(eventClass), eventClass, handler);
  }

  /**
   * Subscribes a handler to events carrying the given type tag.
   *
   * @param eventType tag to receive
   * @param eventClass events with this tag are expected to be instances of
   * @param handler to invoke
   * @param <E> is the type of the event
   */
  <E extends IntegrationEvent> void subscribe(
      final String eventType,
      final Class<E> eventClass,
      final IntegrationEventHandler<? super E> handler);
}
