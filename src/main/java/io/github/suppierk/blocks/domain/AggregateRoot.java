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

import io.github.suppierk.blocks.domain.rules.BusinessRule;
import io.github.suppierk.blocks.domain.rules.BusinessRuleChecker;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents the sole externally addressable entry point of a consistency boundary.
 *
 * <p>Every mutating public method of a derived aggregate must follow the same contract:
 *
 * <ul>
 *   <li>Evaluate every {@link BusinessRule} relevant to the transition via {@link
 *       #checkRule(BusinessRule)} or {@link #checkRules(BusinessRule...)} before touching any field.
 *   <li>Only after all rules pass, change the state.
 *   <li>Record exactly the {@link DomainEvent}s describing the transition via {@link
 *       #raiseDomainEvent(DomainEvent)}.
 * </ul>
 *
 * <p>Pending events are kept in a {@code transient} buffer: they are never a part of the persisted
 * state and are drained by the unit of work via {@link #pullDomainEvents()}. A deserialized
 * aggregate starts with an empty buffer.
 *
 * <p>Aggregates are not thread-safe - callers must serialize access per aggregate identity.
 *
 * @param <ID> is the type of the aggregate identifier
 */
public abstract class AggregateRoot<ID extends Serializable> extends Entity<ID> {
  @Serial private static final long serialVersionUID = -6741402436592513118L;

  private transient List<DomainEvent> domainEvents = new ArrayList<>();

  /** Constructor for aggregates which will receive their identifier later. */
  protected AggregateRoot() {
    super();
  }

  /**
   * @param id to assign to this aggregate
   */
  protected AggregateRoot(final ID id) {
    super(id);
  }

  /**
   * Appends an event to the pending buffer, preserving insertion order.
   *
   * @param domainEvent to record
   * @throws IllegalArgumentException if event is {@code null}
   */
  protected final void raiseDomainEvent(final DomainEvent domainEvent) {
    if (domainEvent == null) {
      throw new IllegalArgumentException("Domain event cannot be null");
    }

    domainEvents.add(domainEvent);
  }

  /**
   * Returns and clears pending events. Calling this method twice without raising new events in
   * between returns an empty list the second time.
   *
   * @return pending events in the order they were raised
   */
  public final List<DomainEvent> pullDomainEvents() {
    final List<DomainEvent> drained = List.copyOf(domainEvents);
    domainEvents.clear();
    return drained;
  }

  /**
   * @return read-only view of pending events, without draining them
   */
  public final List<DomainEvent> peekDomainEvents() {
    return Collections.unmodifiableList(domainEvents);
  }

  /**
   * @param rule to check before mutating the state
   * @see BusinessRuleChecker#checkRule(BusinessRule)
   */
  protected final void checkRule(final BusinessRule rule) {
    BusinessRuleChecker.checkRule(rule);
  }

  /**
   * @param rules to check in order before mutating the state
   * @see BusinessRuleChecker#checkRules(BusinessRule...)
   */
  protected final void checkRules(final BusinessRule... rules) {
    BusinessRuleChecker.checkRules(rules);
  }

  @Serial
  private void readObject(final ObjectInputStream in) throws IOException, ClassNotFoundException {
    in.defaultReadObject();
    domainEvents = new ArrayList<>();
  }
}
