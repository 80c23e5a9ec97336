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

package io.github.suppierk.blocks;

/**
 * Null guards shared by the kernel's infrastructure classes, from command handlers and the
 * integration pipeline to repositories and the jOOQ outbox.
 *
 * <p>The two guards map a {@code null} onto the exception the caller can act upon. A {@code null}
 * argument is the caller's mistake and raises {@link IllegalArgumentException}. A {@code null}
 * property of an otherwise valid argument, such as a command without an aggregate ID, is an invalid
 * message state and raises {@link IllegalStateException}. Neither is a {@code DomainException}, so
 * {@code CommandHandler} lets both propagate instead of reporting them as rule violations.
 *
 * <p>Domain objects do not extend this class: entities and value objects validate through business
 * rules and stay free of infrastructure ancestry.
 */
public abstract class Suspicious {
  /**
   * Guards a property read from an argument, e.g. a field of a command.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalStateException when the value is {@code null}
   */
  protected final <T> T throwIllegalStateIfNull(T value, String whatMustNotBeNull)
      throws IllegalStateException {
    if (value == null) {
      throw new IllegalStateException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }

  /**
   * Guards a method or constructor argument. Properties of arguments go through {@link
   * #throwIllegalStateIfNull(Object, String)} instead.
   *
   * @param value which must not be {@code null}
   * @param whatMustNotBeNull is the parameter name
   * @param <T> is the type of the value
   * @return value if it was not {@code null}
   * @throws IllegalArgumentException when the value is {@code null}
   */
  protected final <T> T throwIllegalArgumentIfNull(T value, String whatMustNotBeNull)
      throws IllegalArgumentException {
    if (value == null) {
      throw new IllegalArgumentException("%s cannot be null".formatted(whatMustNotBeNull));
    }

    return value;
  }
}
