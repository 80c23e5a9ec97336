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

package io.github.suppierk.blocks.jooq;

import io.github.suppierk.blocks.Suspicious;
import io.github.suppierk.blocks.integration.IntegrationEvent;
import io.github.suppierk.blocks.integration.IntegrationEventEnvelope;
import io.github.suppierk.blocks.integration.IntegrationEventSerializer;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.jooq.DSLContext;
import org.jooq.Field;
import org.jooq.Record;
import org.jooq.Table;
import org.jooq.impl.DSL;
import org.jooq.impl.SQLDataType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IntegrationEventOutbox} backed by the {@code integration_event_outbox} table.
 *
 * <p>Events are stored as serialized {@link IntegrationEventEnvelope}s, see {@link
 * IntegrationEventSerializer}. The table can be created with {@link #createTable(DSLContext)}.
 */
public final class JooqIntegrationEventOutbox extends Suspicious implements IntegrationEventOutbox {
  private static final Logger log = LoggerFactory.getLogger(JooqIntegrationEventOutbox.class);

  public static final Table<Record> OUTBOX = DSL.table(DSL.name("integration_event_outbox"));
  public static final Field<Long> POSITION =
      DSL.field(DSL.name("position"), SQLDataType.BIGINT.identity(true));
  public static final Field<UUID> MESSAGE_ID =
      DSL.field(DSL.name("message_id"), SQLDataType.UUID.nullable(false));
  public static final Field<String> EVENT_TYPE =
      DSL.field(DSL.name("event_type"), SQLDataType.VARCHAR(255).nullable(false));
  public static final Field<Integer> EVENT_VERSION =
      DSL.field(DSL.name("event_version"), SQLDataType.INTEGER.nullable(false));
  public static final Field<Instant> OCCURRED_AT =
      DSL.field(DSL.name("occurred_at"), SQLDataType.INSTANT.nullable(false));
  public static final Field<String> ENVELOPE =
      DSL.field(DSL.name("envelope"), SQLDataType.CLOB.nullable(false));
  public static final Field<Instant> PUBLISHED_AT =
      DSL.field(DSL.name("published_at"), SQLDataType.INSTANT.nullable(true));

  private final IntegrationEventSerializer serializer;
  private final Clock clock;

  /** Creates outbox with default serializer and UTC clock. */
  public JooqIntegrationEventOutbox() {
    this(new IntegrationEventSerializer(), Clock.systemUTC());
  }

  /**
   * @param serializer to convert events to JSON
   * @param clock to stamp publication time with
   */
  public JooqIntegrationEventOutbox(
      final IntegrationEventSerializer serializer, final Clock clock) {
    this.serializer = throwIllegalArgumentIfNull(serializer, "Serializer");
    this.clock = throwIllegalArgumentIfNull(clock, "Clock");
  }

  /**
   * Creates the outbox table unless it exists.
   *
   * @param readWriteDsl to execute DDL with
   */
  public static void createTable(final DSLContext readWriteDsl) {
    readWriteDsl
        .createTableIfNotExists(OUTBOX)
        .columns(
            POSITION, MESSAGE_ID, EVENT_TYPE, EVENT_VERSION, OCCURRED_AT, ENVELOPE, PUBLISHED_AT)
        .constraints(DSL.primaryKey(POSITION), DSL.unique(MESSAGE_ID))
        .execute();
  }

  @Override
  public void store(final DSLContext readWriteDsl, final IntegrationEvent event) {
    final DSLContext nonNullDsl = throwIllegalArgumentIfNull(readWriteDsl, "Read-write DSL");
    final IntegrationEvent nonNullEvent = throwIllegalArgumentIfNull(event, "Integration event");

    nonNullDsl
        .insertInto(OUTBOX)
        .set(MESSAGE_ID, nonNullEvent.messageId())
        .set(EVENT_TYPE, nonNullEvent.eventType())
        .set(EVENT_VERSION, nonNullEvent.eventVersion())
        .set(OCCURRED_AT, nonNullEvent.occurredAt())
        .set(ENVELOPE, serializer.serialize(nonNullEvent))
        .execute();

    log.debug(
        "Stored '{}' with message ID '{}' in outbox",
        nonNullEvent.eventType(),
        nonNullEvent.messageId());
  }

  @Override
  public List<IntegrationEventEnvelope> fetchPending(
      final DSLContext readOnlyDsl, final int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("Limit must be positive");
    }

    return throwIllegalArgumentIfNull(readOnlyDsl, "Read-only DSL")
        .select(ENVELOPE)
        .from(OUTBOX)
        .where(PUBLISHED_AT.isNull())
        .orderBy(POSITION.asc())
        .limit(limit)
        .fetch(ENVELOPE)
        .stream()
        .map(serializer::readEnvelope)
        .toList();
  }

  @Override
  public boolean markPublished(final DSLContext readWriteDsl, final UUID messageId) {
    return throwIllegalArgumentIfNull(readWriteDsl, "Read-write DSL")
            .update(OUTBOX)
            .set(PUBLISHED_AT, Instant.now(clock))
            .where(MESSAGE_ID.eq(throwIllegalArgumentIfNull(messageId, "Message ID")))
            .and(PUBLISHED_AT.isNull())
            .execute()
        > 0;
  }
}
