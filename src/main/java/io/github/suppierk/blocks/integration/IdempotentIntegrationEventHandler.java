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

import io.github.suppierk.blocks.Suspicious;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decorates an {@link IntegrationEventHandler} so that a message with an already processed {@link
 * IntegrationEvent#messageId()} is skipped.
 *
 * <p>If the delegate fails, the message is unmarked and the failure is rethrown, so that a
 * redelivery gets another chance.
 *
 * <p>A duplicate arriving while the same message is still being handled by this instance fails with
 * {@link IllegalStateException} instead of being skipped: the first attempt may still fail, and a
 * skipped duplicate would be lost. Across instances sharing a {@link ProcessedMessageStore} only
 * the store's claim applies.
 *
 * @param <E> is the type of the consumed event
 */
public final class IdempotentIntegrationEventHandler<E extends IntegrationEvent> extends Suspicious
    implements IntegrationEventHandler<E> {
  private static final Logger log =
      LoggerFactory.getLogger(IdempotentIntegrationEventHandler.class);

  private final String consumer;
  private final IntegrationEventHandler<E> delegate;
  private final ProcessedMessageStore processedMessageStore;
  private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();

  /**
   * @param consumer unique name of the consumer, messages are deduplicated per consumer
   * @param delegate performing the actual work
   * @param processedMessageStore remembering processed messages
   */
  public IdempotentIntegrationEventHandler(
      final String consumer,
      final IntegrationEventHandler<E> delegate,
      final ProcessedMessageStore processedMessageStore) {
    this.consumer = throwIllegalArgumentIfNull(consumer, "Consumer");
    this.delegate = throwIllegalArgumentIfNull(delegate, "Delegate handler");
    this.processedMessageStore =
        throwIllegalArgumentIfNull(processedMessageStore, "Processed message store");
  }

  @Override
  public void handle(final E event) throws Exception {
    final E nonNullEvent = throwIllegalArgumentIfNull(event, "Integration event");
    final UUID messageId = nonNullEvent.messageId();

    if (!inFlight.add(messageId)) {
      throw new IllegalStateException(
          "%s is still handling '%s' with message ID '%s'"
              .formatted(consumer, nonNullEvent.eventType(), messageId));
    }

    try {
      if (!processedMessageStore.markProcessed(consumer, messageId)) {
        log.debug(
            "{} skips duplicate '{}' with message ID '{}'",
            consumer,
            nonNullEvent.eventType(),
            messageId);
        return;
      }

      try {
        delegate.handle(nonNullEvent);
      } catch (Exception e) {
        processedMessageStore.unmark(consumer, messageId);
        throw e;
      }
    } finally {
      inFlight.remove(messageId);
    }
  }
}
