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

/**
 * Consumer of {@link IntegrationEvent}s published by another context.
 *
 * <p>Delivery is at-least-once, so implementations must be idempotent: either naturally (checking
 * the state of their own aggregates) or by wrapping into {@link
 * IdempotentIntegrationEventHandler}.
 *
 * @param <E> is the type of the consumed event
 */
@FunctionalInterface
public interface IntegrationEventHandler<E extends IntegrationEvent> {
  /**
   * @param event to process
   * @throws Exception if processing failed, the event bus reports it to the publisher
   */
  @SuppressWarnings("squid:S112")
  void handle(final E event) throws Exception;
}
