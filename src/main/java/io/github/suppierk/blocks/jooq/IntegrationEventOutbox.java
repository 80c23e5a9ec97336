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

import io.github.suppierk.blocks.integration.IntegrationEvent;
import io.github.suppierk.blocks.integration.IntegrationEventEnvelope;
import java.util.List;
import java.util.UUID;
import org.jooq.DSLContext;

/**
 * Abstract contract for storing {@link IntegrationEvent}s for later delivery.
 *
 * <p>For the functionality, it is crucial that the event is stored as a part of the same
 * transaction which modified the aggregate, and delivered by a separate process on a schedule,
 * rather than sent immediately. This way the event is stored if and only if the change was
 * committed.
 *
 * <p>A relay reading {@link #fetchPending(DSLContext, int)} and publishing to an {@link
 * io.github.suppierk.blocks.integration.EventBus} is not a part of this library.
 *
 * @see <a href="https://microservices.io/patterns/data/transactional-outbox.html">Transactional
 *     outbox</a>
 */
public interface IntegrationEventOutbox {
  /**
   * @return an instance of outbox which does not perform any operations
   */
  static IntegrationEventOutbox empty() {
    return NoOp.INSTANCE;
  }

  /**
   * Saves {@link IntegrationEvent} to its own table for delivery.
   *
   * @param readWriteDsl is a transactional context with writing capability at the time when the
   *     operation takes place
   * @param event to store
   */
  void store(final DSLContext readWriteDsl, final IntegrationEvent event);

  /**
   * @param readOnlyDsl to query with
   * @param limit maximum number of events to return
   * @return not yet published events in the order they were stored
   */
  List<IntegrationEventEnvelope> fetchPending(final DSLContext readOnlyDsl, final int limit);

  /**
   * @param readWriteDsl to update with
   * @param messageId of the delivered event
   * @return {@code true} if the event was pending and is now marked as published
   */
  boolean markPublished(final DSLContext readWriteDsl, final UUID messageId);

  /** Default implementation of the fake outbox */
  final class NoOp implements IntegrationEventOutbox {
    private static final IntegrationEventOutbox INSTANCE = new NoOp();

    private NoOp() {
      // Cannot be instantiated from the outside
    }

    @Override
    public void store(final DSLContext readWriteDsl, final IntegrationEvent event) {
      // Do nothing
    }

    @Override
    public List<IntegrationEventEnvelope> fetchPending(
        final DSLContext readOnlyDsl, final int limit) {
      return List.of();
    }

    @Override
    public boolean markPublished(final DSLContext readWriteDsl, final UUID messageId) {
      return false;
    }
  }
}
