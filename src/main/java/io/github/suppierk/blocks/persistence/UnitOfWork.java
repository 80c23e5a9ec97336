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

package io.github.suppierk.blocks.persistence;

import io.github.suppierk.blocks.integration.IntegrationEventPipeline;
import io.github.suppierk.blocks.integration.PublicationResult;
import java.util.concurrent.CompletableFuture;

/** Commit point of a command. */
@FunctionalInterface
public interface UnitOfWork {
  /**
   * Atomically persists every added or loaded aggregate, then hands their pending domain events to
   * the {@link IntegrationEventPipeline}. Events are never dispatched if the commit failed.
   *
   * <p>The commit is complete once this method returns; the returned future only tracks
   * publication, and cancelling it does not roll anything back.
   *
   * @return future completed with the outcome of publishing
   */
  CompletableFuture<PublicationResult> saveEntities();
}
