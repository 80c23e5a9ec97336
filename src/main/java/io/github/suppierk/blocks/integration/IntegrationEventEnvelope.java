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

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * Wire shape of an {@link IntegrationEvent}: routing metadata on top, event-specific fields in
 * {@code payload}.
 *
 * @param messageId of the event
 * @param occurredAt of the event
 * @param eventType tag of the event
 * @param eventVersion of the event schema
 * @param payload JSON object holding the remaining event fields
 */
public record IntegrationEventEnvelope(
    UUID messageId, Instant occurredAt, String eventType, int eventVersion, JsonNode payload) {
  public IntegrationEventEnvelope {
    if (messageId == null) {
      throw new IllegalArgumentException("Message ID cannot be null");
    }

    if (occurredAt == null) {
      throw new IllegalArgumentException("Occurrence timestamp cannot be null");
    }

    if (eventType == null || eventType.isBlank()) {
      throw new IllegalArgumentException("Event type cannot be blank");
    }

    if (payload == null || !payload.isObject()) {
      throw new IllegalArgumentException("Payload must be a JSON object");
    }
  }
}
