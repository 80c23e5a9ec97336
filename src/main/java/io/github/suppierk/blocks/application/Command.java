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

package io.github.suppierk.blocks.application;

import java.io.Serializable;
import java.time.temporal.Temporal;

/**
 * Represents an immutable intent to change the state of exactly one aggregate.
 *
 * <p>It is highly recommended to use this interface with Java {@link Record}s.
 *
 * <p>Commands must be task-oriented, not data-centric - e.g. 'Submit Order' instead of 'Set Order
 * status to SUBMITTED'.
 *
 * <p>Commands can be queued rather than processed synchronously - this is the reason this interface
 * extends {@link Serializable} interface.
 *
 * @param <I> is the type of the command identifier
 * @param <T> is the type of the timestamp when this command was created
 */
// @formatter:off
public interface Command<
  I extends Serializable,
  T extends Temporal & Serializable
> extends Serializable {
// @formatter:on

  /**
   * Defined as {@code messageId()} because:
   *
   * <ul>
   *   <li>{@code getMessageId()} is not friendly towards Java {@link Record}s.
   *   <li>{@code id()} is quite frequently taken to describe the ID of the aggregate we are
   *       interacting with.
   * </ul>
   *
   * @return an identifier for the current command
   */
  I messageId();

  /**
   * @return the time when this command was created
   */
  T createdAt();
}
