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
import java.io.Serializable;
import java.util.Objects;

/**
 * Represents a domain object which is defined by its identity rather than by its attributes.
 *
 * <p>Two entities are equal if and only if:
 *
 * <ul>
 *   <li>They are of the same concrete runtime class.
 *   <li>Both have an identifier assigned, and neither identifier is a default one.
 *   <li>Their identifiers are equal.
 * </ul>
 *
 * <p>An entity without a real identifier is called <i>transient</i>: two distinct transient
 * instances are never equal, which prevents false positives before an identifier is assigned. The
 * same instance is still equal to itself, as {@link Object#equals(Object)} requires.
 *
 * <p>The identifier is assigned once by the derived type and never reassigned afterwards.
 *
 * @param <ID> is the type of the entity identifier
 */
public abstract class Entity<ID extends Serializable> implements Serializable {
  @Serial private static final long serialVersionUID = 4518052981146721871L;

  private ID id;

  /** Constructor for entities which will receive their identifier later. */
  protected Entity() {
    this.id = null;
  }

  /**
   * @param id to assign to this entity
   * @throws IllegalArgumentException if identifier is {@code null}
   */
  protected Entity(final ID id) {
    setId(id);
  }

  /**
   * @return current entity identifier, {@code null} for transient entities
   */
  public final ID getId() {
    return id;
  }

  /**
   * Assigns the identifier of this entity.
   *
   * @param id to assign
   * @throws IllegalArgumentException if identifier is {@code null}
   * @throws IllegalStateException if identifier was already assigned
   */
  protected final void setId(final ID id) {
    if (id == null) {
      throw new IllegalArgumentException("Entity identifier cannot be null");
    }

    if (this.id != null) {
      throw new IllegalStateException(
          "%s identifier is already assigned".formatted(getClass().getSimpleName()));
    }

    this.id = id;
  }

  /**
   * @return {@code true} if this entity has no real identifier yet
   */
  public final boolean isTransient() {
    return id == null || isDefaultIdentifier(id);
  }

  /**
   * Allows derived types to declare sentinel identifier values, such as nil {@link
   * java.util.UUID}s, as "not assigned".
   *
   * @param candidate identifier to check, never {@code null}
   * @return {@code true} if the identifier should be treated as unassigned
   */
  protected boolean isDefaultIdentifier(final ID candidate) {
    return false;
  }

  @Override
  public final boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    final Entity<?> that = (Entity<?>) o;
    if (isTransient() || that.isTransient()) return false;

    return id.equals(that.id);
  }

  @Override
  public final int hashCode() {
    if (isTransient()) {
      return System.identityHashCode(this);
    }

    return Objects.hash(getClass(), id);
  }

  @Override
  public String toString() {
    return "%s[id=%s]".formatted(getClass().getSimpleName(), id);
  }
}
