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

import io.github.suppierk.blocks.domain.DomainException;
import java.io.Serial;

/** A specific {@link Exception} to be thrown if a requested aggregate does not exist. */
public class NotFoundException extends DomainException {
  @Serial private static final long serialVersionUID = 2906143711297702584L;

  public static final String CODE = "NOT_FOUND";

  /**
   * Constructs a new exception with the specified detail message.
   *
   * @param message the detail message (which is saved for later retrieval by the {@link
   *     #getMessage()} method).
   */
  public NotFoundException(String message) {
    super(CODE, message);
  }

  /**
   * @param aggregateType which was requested
   * @param id which was requested
   * @return exception describing the missing aggregate
   */
  public static NotFoundException of(final Class<?> aggregateType, final Object id) {
    return new NotFoundException(
        "%s '%s' does not exist".formatted(aggregateType.getSimpleName(), id));
  }

  /**
   * @return the most appropriate HTTP status code for this exception for consumer convenience.
   * @see <a href="https://rules.sonarsource.com/java/RSPEC-3400/">Suppressed Sonar rule to clearly
   *     show that this method will only return the same value</a>
   */
  @Override
  @SuppressWarnings("squid:S3400")
  public int getStatusCode() {
    return 404;
  }
}
