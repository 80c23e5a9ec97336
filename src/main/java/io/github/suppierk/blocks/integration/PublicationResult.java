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

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of dispatching pending events of one or more aggregates.
 *
 * @param published events which were handed over to the {@link EventBus}, in publication order
 * @param failed events which could not be published after all retries
 */
public record PublicationResult(List<IntegrationEvent> published, List<IntegrationEvent> failed) {
  private static final PublicationResult EMPTY = new PublicationResult(List.of(), List.of());

  public PublicationResult {
    published = List.copyOf(published);
    failed = List.copyOf(failed);
  }

  /**
   * @return result without any events
   */
  public static PublicationResult empty() {
    return EMPTY;
  }

  /**
   * @return {@code true} if nothing failed
   */
  public boolean isSuccessful() {
    return failed.isEmpty();
  }

  /**
   * @param other result to append
   * @return a new result containing events of both, this one first
   */
  public PublicationResult merge(final PublicationResult other) {
    if (other == null) {
      throw new IllegalArgumentException("Publication result cannot be null");
    }

    final List<IntegrationEvent> mergedPublished = new ArrayList<>(published);
    mergedPublished.addAll(other.published());

    final List<IntegrationEvent> mergedFailed = new ArrayList<>(failed);
    mergedFailed.addAll(other.failed());

    return new PublicationResult(mergedPublished, mergedFailed);
  }
}
