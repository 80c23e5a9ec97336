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

package io.github.suppierk.blocks.domain;

import java.io.Serial;

/**
 * Base {@link Exception} for failures which carry a machine-readable code and are expected to be
 * reported back to the caller in a structured way rather than crash the application.
 *
 * <p>Every subclass is recovered at the command handler boundary, see {@link
 * io.github.suppierk.blocks.application.CommandHandler}.
 */
public abstract class DomainException extends RuntimeException {
  @Serial private static final long serialVersionUID = -5370846010858393011L;

  private final String code;

  /**
   * Constructs a new domain exception with the specified code and detail message.
   *
   * @param code machine-readable reason of the failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  protected DomainException(final String code, final String message) {
    super(message);
    this.code = code;
  }

  /**
   * Constructs a new domain exception with the specified code, detail message and cause.
   *
   * @param code machine-readable reason of the failure
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   * @param cause the cause (which is saved for later retrieval by the {@link #getCause()} method).
   */
  protected DomainException(final String code, final String message, final Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  /**
   * @return machine-readable reason of the failure
   */
  public final String getCode() {
    return code;
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   */
  public abstract int getStatusCode();
}
