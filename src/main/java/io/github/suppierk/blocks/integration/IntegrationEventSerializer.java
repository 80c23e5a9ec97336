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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.util.List;

/**
 * JSON codec for {@link IntegrationEvent}s based on Jackson.
 *
 * <p>Every event is written as an {@link IntegrationEventEnvelope}:
 *
 * <pre>{@code
 * {
 *   "messageId": "...",
 *   "occurredAt": "2024-01-01T10:00:00Z",
 *   "eventType": "OrderSubmittedIntegrationEvent",
 *   "eventVersion": 1,
 *   "payload": { ...remaining fields of the event... }
 * }
 * }</pre>
 *
 * <p>Timestamps are ISO-8601 strings, decimals keep their scale, unknown payload fields are ignored
 * on read so that producers can add fields without breaking consumers.
 */
public final class IntegrationEventSerializer {
  private static final String MESSAGE_ID = "messageId";
  private static final String OCCURRED_AT = "occurredAt";
  private static final List<String> ENVELOPE_FIELDS =
      List.of(MESSAGE_ID, OCCURRED_AT, "eventType", "eventVersion");

  private final ObjectMapper mapper;

  /** Creates serializer backed by {@link #defaultMapper()}. */
  public IntegrationEventSerializer() {
    this(defaultMapper());
  }

  /**
   * @param mapper to use, must be able to handle {@code java.time} types
   * @throws IllegalArgumentException if mapper is {@code null}
   */
  public IntegrationEventSerializer(final ObjectMapper mapper) {
    if (mapper == null) {
      throw new IllegalArgumentException("Object mapper cannot be null");
    }

    this.mapper = mapper;
  }

  /**
   * @return a new mapper configured for integration events
   */
  public static ObjectMapper defaultMapper() {
    return new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
  }

  /**
   * @param event to wrap
   * @return envelope holding event metadata and its remaining fields as payload
   */
  public IntegrationEventEnvelope toEnvelope(final IntegrationEvent event) {
    if (event == null) {
      throw new IllegalArgumentException("Integration event cannot be null");
    }

    final ObjectNode payload = mapper.valueToTree(event);
    payload.remove(ENVELOPE_FIELDS);

    return new IntegrationEventEnvelope(
        event.messageId(), event.occurredAt(), event.eventType(), event.eventVersion(), payload);
  }

  /**
   * @param envelope to unwrap
   * @param eventClass expected event type
   * @return restored event
   * @param <E> is the type of the event
   * @throws IntegrationEventSerializationException if payload does not fit the event class
   */
  public <E extends IntegrationEvent> E fromEnvelope(
      final IntegrationEventEnvelope envelope, final Class<E> eventClass) {
    if (envelope == null) {
      throw new IllegalArgumentException("Envelope cannot be null");
    }

    if (eventClass == null) {
      throw new IllegalArgumentException("Integration event class cannot be null");
    }

    final ObjectNode fields = (ObjectNode) envelope.payload().deepCopy();
    fields.put(MESSAGE_ID, envelope.messageId().toString());
    fields.put(OCCURRED_AT, envelope.occurredAt().toString());

    try {
      return mapper.treeToValue(fields, eventClass);
    } catch (JsonProcessingException e) {
      throw new IntegrationEventSerializationException(
          "Failed to restore '%s' from envelope '%s'"
              .formatted(eventClass.getSimpleName(), envelope.messageId()),
          e);
    }
  }

  /**
   * @param event to serialize
   * @return JSON representation of the event envelope
   * @throws IntegrationEventSerializationException if serialization fails
   */
  public String serialize(final IntegrationEvent event) {
    final IntegrationEventEnvelope envelope = toEnvelope(event);

    try {
      return mapper.writeValueAsString(envelope);
    } catch (JsonProcessingException e) {
      throw new IntegrationEventSerializationException(
          "Failed to serialize event '%s'".formatted(envelope.messageId()), e);
    }
  }

  /**
   * @param json to read
   * @return envelope without interpreting the payload
   * @throws IntegrationEventSerializationException if JSON is malformed
   */
  public IntegrationEventEnvelope readEnvelope(final String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON cannot be null");
    }

    try {
      return mapper.readValue(json, IntegrationEventEnvelope.class);
    } catch (JsonProcessingException e) {
      throw new IntegrationEventSerializationException("Failed to read event envelope", e);
    }
  }

  /**
   * @param json to read
   * @param eventClass expected event type
   * @return restored event
   * @param <E> is the type of the event
   * @throws IntegrationEventSerializationException if JSON is malformed or does not fit the class
   */
  public <E extends IntegrationEvent> E deserialize(final String json, final Class<E> eventClass) {
    return fromEnvelope(readEnvelope(json), eventClass);
  }
}
