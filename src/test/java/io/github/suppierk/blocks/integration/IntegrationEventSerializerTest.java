package io.github.suppierk.blocks.integration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class IntegrationEventSerializerTest {
  record ShipmentDispatched(
      UUID messageId, Instant occurredAt, String shipmentId, BigDecimal weight)
      implements IntegrationEvent {
    @Override
    public int eventVersion() {
      return 2;
    }
  }

  static final IntegrationEventSerializer SERIALIZER = new IntegrationEventSerializer();
  static final ShipmentDispatched EVENT =
      new ShipmentDispatched(
          UUID.fromString("1b4e28ba-2fa1-11d2-883f-0016d3cca427"),
          Instant.parse("2024-05-01T10:15:30Z"),
          "SHP-7",
          new BigDecimal("12.50"));

  @Nested
  class Envelope {
    @Test
    void envelope_carries_metadata_and_payload_without_duplicating_it() {
      final var envelope = SERIALIZER.toEnvelope(EVENT);

      assertEquals(EVENT.messageId(), envelope.messageId());
      assertEquals(EVENT.occurredAt(), envelope.occurredAt());
      assertEquals("ShipmentDispatched", envelope.eventType());
      assertEquals(2, envelope.eventVersion());
      assertEquals("SHP-7", envelope.payload().get("shipmentId").asText());
      assertFalse(envelope.payload().has("messageId"));
      assertFalse(envelope.payload().has("occurredAt"));
    }

    @Test
    void event_is_restored_from_envelope() {
      assertEquals(
          EVENT,
          SERIALIZER.fromEnvelope(SERIALIZER.toEnvelope(EVENT), ShipmentDispatched.class));
    }

    @Test
    void null_arguments_throw_illegal_argument_exception() {
      assertThrows(IllegalArgumentException.class, () -> SERIALIZER.toEnvelope(null));
      assertThrows(
          IllegalArgumentException.class,
          () -> SERIALIZER.fromEnvelope(null, ShipmentDispatched.class));
    }
  }

  @Nested
  class Json {
    @Test
    void timestamps_are_written_as_iso_strings() {
      final var json = SERIALIZER.serialize(EVENT);

      assertTrue(json.contains("\"occurredAt\":\"2024-05-01T10:15:30Z\""), json);
    }

    @Test
    void decimal_scale_survives_the_wire() {
      final var restored =
          SERIALIZER.deserialize(SERIALIZER.serialize(EVENT), ShipmentDispatched.class);

      assertEquals(new BigDecimal("12.50"), restored.weight());
    }

    @Test
    void unknown_payload_fields_are_ignored() {
      final var json =
          SERIALIZER
              .serialize(EVENT)
              .replace("\"shipmentId\":", "\"carrier\":\"ACME\",\"shipmentId\":");

      assertEquals(EVENT, SERIALIZER.deserialize(json, ShipmentDispatched.class));
    }

    @Test
    void malformed_json_throws_serialization_exception() {
      assertThrows(
          IntegrationEventSerializationException.class,
          () -> SERIALIZER.readEnvelope("{not json"));
    }

    @Test
    void envelope_without_payload_object_is_rejected() {
      final var json =
          SERIALIZER.serialize(EVENT).replaceFirst("\"payload\":\\{.*}}$", "\"payload\":[]}");

      assertThrows(
          IntegrationEventSerializationException.class, () -> SERIALIZER.readEnvelope(json));
    }
  }
}
