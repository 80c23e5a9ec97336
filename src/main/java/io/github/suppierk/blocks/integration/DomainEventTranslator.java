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

import io.github.suppierk.blocks.domain.DomainEvent;

/**
 * Maps one internal {@link DomainEvent} to exactly one public {@link IntegrationEvent}, stripping
 * everything that must not leave the context.
 *
 * @param <D> is the type of the domain event
 * @param <I> is the type of the integration event
 */
@FunctionalInterface
public interface DomainEventTranslator<D extends DomainEvent, I extends IntegrationEvent> {
  /**
   * @param domainEvent to translate
   * @return integration event, never {@code null}
   */
  I translate(final D domainEvent);
}
