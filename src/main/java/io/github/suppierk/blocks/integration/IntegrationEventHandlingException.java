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

import java.io.Serial;

/**
 * A specific {@link Exception} to be thrown if a subscriber failed to process an {@link
 * IntegrationEvent}.
 */
public class IntegrationEventHandlingException extends RuntimeException {
  @Serial private static final long serialVersionUID = -8807447063415227960L;

  private final transient IntegrationEvent event;

  /**
   * @param event which failed to be processed
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  public IntegrationEventHandlingException(IntegrationEvent event, Throwable cause) {
    super(
        "Failed to handle '%s' with message ID '%s'"
            .formatted(event.eventType(), event.messageId()),
        cause);
    this.event = event;
  }

  /**
   * @return event which failed to be processed
   */
  public IntegrationEvent getEvent() {
    return event;
  }
}
