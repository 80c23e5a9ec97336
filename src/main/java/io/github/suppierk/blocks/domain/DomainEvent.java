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

package io.github.suppierk.blocks.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents an immutable fact about something that happened inside an {@link AggregateRoot}.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s, carrying identifiers
 * and the minimal data needed to describe <i>what</i> happened, never <i>how</i>.
 *
 * <p>Domain events are raised only by aggregate methods and live until they are drained at the end
 * of the unit of work - they are never persisted together with the aggregate state. Crossing the
 * bounded context boundary requires translating them into {@link
 * io.github.suppierk.blocks.integration.IntegrationEvent}s first.
 */
public interface DomainEvent extends Serializable {
  /**
   * Defined as {@code eventId()} rather than {@code id()} because the latter is quite frequently
   * taken to describe the ID of the aggregate the event refers to.
   *
   * @return a unique identifier of this event
   */
  UUID eventId();

  /**
   * @return the time when this event was created
   */
  Instant occurredAt();
}
