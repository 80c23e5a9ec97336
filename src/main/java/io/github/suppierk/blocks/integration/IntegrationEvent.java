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

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents a message crossing the boundary between two contexts.
 *
 * <p>Unlike {@link io.github.suppierk.blocks.domain.DomainEvent}, integration events are a public
 * contract: they must carry only portable data (strings, numbers, timestamps) and never reference
 * domain types of the producing context. Implementations are expected to be immutable records.
 *
 * <p>Consumers must tolerate duplicates, see {@link IdempotentIntegrationEventHandler}.
 */
public interface IntegrationEvent extends Serializable {
  /**
   * @return unique identifier of this message, used for deduplication
   */
  UUID messageId();

  /**
   * @return moment when the underlying fact happened
   */
  Instant occurredAt();

  /**
   * @return type tag used for routing and on the wire
   */
  default String eventType() {
    return eventTypeOf(getClass());
  }

  /**
   * @return version of the message schema
   */
  default int eventVersion() {
    return 1;
  }

  /**
   * @param eventClass to describe
   * @return default type tag of the given event class
   */
  static String eventTypeOf(final Class<? extends IntegrationEvent> eventClass) {
    if (eventClass == null) {
      throw new IllegalArgumentException("Integration event class cannot be null");
    }

    return eventClass.getSimpleName();
  }
}
