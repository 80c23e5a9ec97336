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

/** {@link ProcessedMessageStore} keeping processed message IDs in memory. */
public final class InMemoryProcessedMessageStore extends Suspicious
    implements ProcessedMessageStore {
  private final Set<String> processed = ConcurrentHashMap.newKeySet();

  @Override
  public boolean markProcessed(final String consumer, final UUID messageId) {
    return processed.add(key(consumer, messageId));
  }

  @Override
  public void unmark(final String consumer, final UUID messageId) {
    processed.remove(key(consumer, messageId));
  }

  @Override
  public boolean isProcessed(final String consumer, final UUID messageId) {
    return processed.contains(key(consumer, messageId));
  }

  private String key(final String consumer, final UUID messageId) {
    return throwIllegalArgumentIfNull(consumer, "Consumer")
        + ":"
        + throwIllegalArgumentIfNull(messageId, "Message ID");
  }
}
