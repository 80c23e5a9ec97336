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

import java.util.UUID;

/** Remembers which messages were already processed by which consumer. */
public interface ProcessedMessageStore {
  /**
   * Atomically records the message as processed by the consumer.
   *
   * @param consumer name of the processing handler
   * @param messageId of the processed message
   * @return {@code true} if the message was not seen by this consumer before
   */
  boolean markProcessed(final String consumer, final UUID messageId);

  /**
   * Reverts {@link #markProcessed(String, UUID)}, so that a failed message can be redelivered.
   *
   * @param consumer name of the processing handler
   * @param messageId of the message
   */
  void unmark(final String consumer, final UUID messageId);

  /**
   * @param consumer name of the processing handler
   * @param messageId of the message
   * @return {@code true} if the message was processed by this consumer
   */
  boolean isProcessed(final String consumer, final UUID messageId);
}
